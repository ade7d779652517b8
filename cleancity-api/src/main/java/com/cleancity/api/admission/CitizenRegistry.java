package com.cleancity.api.admission;

import com.cleancity.core.domain.Citizen;
import com.cleancity.core.repository.CitizenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/**
 * Creates the citizen row on a device's first submission, in its own transaction,
 * so the admission transaction can always lock an existing row.
 * Must be called outside any surrounding transaction.
 */
@Component
public class CitizenRegistry {

    private static final Logger log = LoggerFactory.getLogger(CitizenRegistry.class);

    private final CitizenRepository citizenRepository;
    private final TransactionTemplate requiresNew;

    public CitizenRegistry(CitizenRepository citizenRepository, PlatformTransactionManager transactionManager) {
        this.citizenRepository = citizenRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void ensureRegistered(String deviceId, Instant now) {
        try {
            requiresNew.executeWithoutResult(status -> {
                if (!citizenRepository.existsById(deviceId)) {
                    citizenRepository.saveAndFlush(Citizen.create(deviceId, now));
                    log.info("Registered citizen device={}", deviceId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            // lost the insert race; the row exists now
            log.debug("Citizen {} registered concurrently", deviceId);
        }
    }
}
