package com.example.dutyroster.roster;

import java.time.LocalDate;

public record AllocationView(
        Long allocationId,
        LocalDate date,
        Long postId,
        String postName,
        Long personId,
        String personName,
        boolean punishment
) {
    public static AllocationView from(Allocation allocation) {
        return new AllocationView(
                allocation.getId(),
                allocation.getDate(),
                allocation.getPost().getId(),
                allocation.getPost().getName(),
                allocation.getPerson().getId(),
                allocation.getPerson().getName(),
                allocation.isPunishment()
        );
    }
}
