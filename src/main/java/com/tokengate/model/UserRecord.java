package com.tokengate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserRecord {
    private String groupId;
    private String userId;
    private String address;
    private boolean verified;
    private long lastVerifiedAt;
    private boolean verificationTxConfirmed;
    private boolean evictionPending;    // set when the balance fell short, cleared by removal or re-verification

    /**
     * True when {@code other} describes the same verification: same wallet and same
     * {@code lastVerifiedAt}. A newer verification or balance refresh breaks the match.
     */
    public boolean sameVerificationAs(UserRecord other) {
        return other != null
                && verified == other.verified
                && lastVerifiedAt == other.lastVerifiedAt
                && address != null
                && address.equalsIgnoreCase(other.address);
    }
}
