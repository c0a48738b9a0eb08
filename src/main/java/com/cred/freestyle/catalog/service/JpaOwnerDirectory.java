package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.DeactivatedOwner;
import com.cred.freestyle.catalog.repository.DeactivatedOwnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner directory backed by the deactivated_owner table.
 *
 * @author Catalog Team
 */
@Service
public class JpaOwnerDirectory implements OwnerDirectory {

    private static final Logger logger = LoggerFactory.getLogger(JpaOwnerDirectory.class);

    private final DeactivatedOwnerRepository deactivatedOwnerRepository;

    public JpaOwnerDirectory(DeactivatedOwnerRepository deactivatedOwnerRepository) {
        this.deactivatedOwnerRepository = deactivatedOwnerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isDeactivated(String ownerId) {
        return deactivatedOwnerRepository.existsById(ownerId);
    }

    @Override
    @Transactional
    public void deactivate(String ownerId, String deactivatedBy) {
        if (deactivatedOwnerRepository.existsById(ownerId)) {
            logger.debug("Owner {} is already deactivated", ownerId);
            return;
        }
        deactivatedOwnerRepository.save(DeactivatedOwner.builder()
                .ownerId(ownerId)
                .deactivatedBy(deactivatedBy)
                .build());
        logger.info("Deactivated owner {} (by {})", ownerId, deactivatedBy);
    }

    @Override
    @Transactional
    public void reactivate(String ownerId) {
        if (deactivatedOwnerRepository.existsById(ownerId)) {
            deactivatedOwnerRepository.deleteById(ownerId);
            logger.info("Reactivated owner {}", ownerId);
        }
    }
}
