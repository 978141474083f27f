package com.example.dutyroster.swap;

import com.example.dutyroster.roster.Allocation;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record SwapView(
        Long id,
        Long requesterId,
        String requesterName,
        Long substituteId,
        String substituteName,
        Long allocationId,
        LocalDate dutyDate,
        String postName,
        Long counterAllocationId,
        LocalDate counterDutyDate,
        SwapStatus status,
        String reason,
        LocalDateTime createdAt,
        LocalDateTime respondedAt,
        Long processedBy
) {
    public static SwapView from(SwapRequest request) {
        Allocation allocation = request.getAllocation();
        Allocation counter = request.getCounterAllocation();
        return new SwapView(
                request.getId(),
                request.getRequester().getId(),
                request.getRequester().getName(),
                request.getSubstitute().getId(),
                request.getSubstitute().getName(),
                allocation != null ? allocation.getId() : null,
                allocation != null ? allocation.getDate() : null,
                allocation != null ? allocation.getPost().getName() : null,
                counter != null ? counter.getId() : null,
                counter != null ? counter.getDate() : null,
                request.getStatus(),
                request.getReason(),
                request.getCreatedAt(),
                request.getRespondedAt(),
                request.getProcessedBy()
        );
    }
}
