package com.affinity.x.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityScoreId implements Serializable {
    private UUID viewerId;
    private UUID candidateId;
}
