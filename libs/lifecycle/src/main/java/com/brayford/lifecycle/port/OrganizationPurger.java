package com.brayford.lifecycle.port;

import com.brayford.lifecycle.DeletedOrganizationAudit;

/**
 * Permanently removes an organization's data once its deletion request is due for completion.
 * <p>
 * Runs before the request is marked completed and is called again for the same organization
 * when an earlier attempt threw, so implementations must be idempotent.
 */
public interface OrganizationPurger {

    /**
     * @param audit the archival record kept after the organization's own data is gone
     */
    void purge(DeletedOrganizationAudit audit);
}
