package com.example.filingcontacts.service.contact;

import com.example.filingcontacts.dto.DedupReport;
import com.example.filingcontacts.repository.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Deduplicates the stored contact set. A dry run only reports; otherwise every
 * duplicate is deleted and the earliest record of each group survives.
 */
@Service
public class DeduplicationService {

    private static final Logger logger = LoggerFactory.getLogger(DeduplicationService.class);

    private final ContactRepository contactRepository;
    private final DeduplicationEngine engine;

    public DeduplicationService(ContactRepository contactRepository, DeduplicationEngine engine) {
        this.contactRepository = contactRepository;
        this.engine = engine;
    }

    @Transactional
    public DedupReport deduplicate(DedupMode mode, boolean dryRun) {
        DedupReport report = engine.deduplicate(contactRepository.findAllByOrderByCreatedAtAscIdAsc(), mode, dryRun);
        List<Long> duplicateIds = report.getDuplicateIds();

        logger.info("Dedup ({}{}): {} contacts, {} unique, {} duplicates in {} clusters",
                mode.getLabel(), dryRun ? ", dry run" : "", report.getTotalContacts(),
                report.getUnique().size(), duplicateIds.size(), report.getClusters().size());

        if (!dryRun && !duplicateIds.isEmpty()) {
            contactRepository.deleteAllByIdInBatch(duplicateIds);
            report.setDeletedCount(duplicateIds.size());
            logger.info("✅ Deleted {} duplicate contacts", duplicateIds.size());
        }
        return report;
    }
}
