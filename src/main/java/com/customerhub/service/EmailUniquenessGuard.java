package com.customerhub.service;

import com.customerhub.exception.DuplicateResourceException;
import com.customerhub.store.CustomerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Keeps emails unique among active customers.
 *
 * The check reads the store at write time. It does not close the window between
 * check and write; the store's own constraint does.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailUniquenessGuard {

    private final CustomerStore customerStore;

    /**
     * Verify that no other active customer uses an email.
     *
     * @param email Email about to be written
     * @param excludingId Id of the customer being updated, or null on create
     * @return Empty on success, {@link DuplicateResourceException} on a clash
     */
    public Mono<Void> ensureAvailable(String email, UUID excludingId) {
        return customerStore.findByEmail(email, true)
                .filter(existing -> !existing.getId().equals(excludingId))
                .flatMap(existing -> {
                    log.debug("Email {} already held by active customer {}", email, existing.getId());
                    return Mono.<Void>error(new DuplicateResourceException("Customer", email));
                });
    }
}
