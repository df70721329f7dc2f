package com.brayford.organization.infrastructure.purge;

import com.brayford.lifecycle.DeletedOrganizationAudit;
import com.brayford.lifecycle.DeletionRequestSerializer;
import com.brayford.lifecycle.port.MemberStore;
import com.brayford.lifecycle.port.OrganizationPurger;
import com.brayford.lifecycle.port.TenantDirectory;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes a deleted organization's members and directory entry, keeping the archival record as
 * JSON.
 */
@Component
public class InMemoryOrganizationPurger implements OrganizationPurger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOrganizationPurger.class);

    private final MemberStore members;
    private final TenantDirectory directory;
    private final Map<String, String> archives = new ConcurrentHashMap<>();

    public InMemoryOrganizationPurger(MemberStore members, TenantDirectory directory) {
        this.members = members;
        this.directory = directory;
    }

    @Override
    public void purge(DeletedOrganizationAudit audit) {
        archives.put(audit.organizationId(), DeletionRequestSerializer.serializeArchive(audit));
        int removed = members.deleteByOrganization(audit.organizationId());
        boolean directoryRemoved = directory.removeOrganization(audit.organizationId());
        log.info("Purged organization {}: {} memberships removed, directory entry {}",
                audit.organizationId(), removed, directoryRemoved ? "removed" : "already absent");
    }

    /** The archived JSON record for a purged organization. */
    public Optional<String> archiveFor(String organizationId) {
        return Optional.ofNullable(archives.get(organizationId));
    }
}
