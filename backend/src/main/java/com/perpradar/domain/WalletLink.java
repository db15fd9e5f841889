package com.perpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Subscriber → wallet link. Deactivated on remove or FIFO eviction; a re-added wallet gets a new link.
 * Address is always lowercase.
 */
@Document(collection = "wallet_links")
@CompoundIndexes({
        @CompoundIndex(name = "subscriber_active_added", def = "{'subscriberId': 1, 'active': 1, 'addedAt': 1}"),
        @CompoundIndex(name = "address_active", def = "{'address': 1, 'active': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletLink {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Long subscriberId;
    private String address;
    private Instant addedAt;
    private boolean active;
}
