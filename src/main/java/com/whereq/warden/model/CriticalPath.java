package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Longest dependency chain of a batch, measured in edges
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CriticalPath {
    public static final CriticalPath EMPTY = new CriticalPath(0, List.of());

    /**
     * Number of edges on the longest chain
     */
    private int length;

    /**
     * Jobs whose distance from a root equals the length
     */
    private List<String> nodes = new ArrayList<>();
}
