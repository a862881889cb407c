package com.tokengate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationLink {
    private String token;       // opaque, URL-safe
    private String groupId;
    private long createdAt;
}
