package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.journal.JournalStatus;
import lombok.Value;

import java.util.List;

/**
 * Where a validated, authorized entry goes next: straight to POSTED, or held
 * as PENDING_APPROVAL for the listed roles.
 */
@Value
public class PostingDecision {
    JournalStatus status;
    List<String> approverRoles;
    String reason;

    public boolean requiresApproval() {
        return status == JournalStatus.PENDING_APPROVAL;
    }
}
