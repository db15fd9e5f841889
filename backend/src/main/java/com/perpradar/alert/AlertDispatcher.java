package com.perpradar.alert;

import java.util.Collection;

/**
 * Delivers a rendered alert to each recipient independently.
 */
public interface AlertDispatcher {

    /**
     * @return number of recipients the message was delivered to; failures are logged, never thrown
     */
    int dispatch(Collection<Long> recipients, String message);
}
