package com.flagship.gl_posting.idempotency;

import lombok.Value;

/**
 * What the gate says about an incoming request.
 */
@Value
public class AdmitOutcome {

    public enum Type {
        /** Key unseen (or expired): process, then record the response. */
        FRESH,
        /** Same key, same payload: return the stored response, do nothing else. */
        REPLAY,
        /** Same key, different payload: client error. */
        CONFLICT
    }

    Type type;
    String storedResponse;

    public static AdmitOutcome fresh() {
        return new AdmitOutcome(Type.FRESH, null);
    }

    public static AdmitOutcome replay(String storedResponse) {
        return new AdmitOutcome(Type.REPLAY, storedResponse);
    }

    public static AdmitOutcome conflict() {
        return new AdmitOutcome(Type.CONFLICT, null);
    }
}
