package com.whereq.roundhouse.store;

import lombok.Value;

/**
 * Sorted-set member together with its score
 */
@Value
public class ScoredMember {
    String member;
    double score;
}
