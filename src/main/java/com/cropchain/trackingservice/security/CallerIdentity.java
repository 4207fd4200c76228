package com.cropchain.trackingservice.security;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Who is calling, as established by the authentication step. The service trusts these values
 * verbatim.
 */
@Value
@Builder
public class CallerIdentity {

    public static final String ROLE_ADMIN = "admin";

    String userId;
    /** Farmer-scoped identity carried by farmer accounts; may be null. */
    String farmerId;
    String role;
    String email;

    public boolean isAdmin() {
        return ROLE_ADMIN.equals(role);
    }

    /**
     * The identifier written as {@code farmerId} on batches this caller creates.
     */
    public String ownerId() {
        return farmerId != null ? farmerId : userId;
    }

    /**
     * True when the given batch owner is this caller under either of its identities.
     */
    public boolean owns(String batchFarmerId) {
        if (batchFarmerId == null) {
            return false;
        }
        return Objects.equals(batchFarmerId, farmerId) || Objects.equals(batchFarmerId, userId);
    }
}
