package com.example.litigationhold.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Contiguous slice of an ordered input, numbered from 1.
 */
@Value
public class Batch<T> {

    int index;
    int totalBatches;
    List<T> items;

    public int size() {
        return items.size();
    }

    public boolean isLast() {
        return index == totalBatches;
    }
}
