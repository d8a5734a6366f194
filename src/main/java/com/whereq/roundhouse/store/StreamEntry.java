package com.whereq.roundhouse.store;

import lombok.Value;

import java.util.Map;

/**
 * One stream entry: the store-assigned id and its fields
 */
@Value
public class StreamEntry {
    String id;
    Map<String, String> fields;
}
