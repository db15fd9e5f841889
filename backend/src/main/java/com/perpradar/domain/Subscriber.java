package com.perpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Notification recipient keyed by Telegram chat id. Deactivated on unsubscribe, never deleted.
 */
@Document(collection = "subscribers")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Subscriber {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String displayName;
    private Instant subscribedAt;
    @Indexed
    private boolean active;
}
