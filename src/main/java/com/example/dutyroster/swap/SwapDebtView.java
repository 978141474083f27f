package com.example.dutyroster.swap;

import java.time.LocalDateTime;

public record SwapDebtView(
        Long id,
        Long debtorId,
        String debtorName,
        Long creditorId,
        String creditorName,
        Long originSwapId,
        DebtStatus status,
        LocalDateTime createdAt
) {
    public static SwapDebtView from(SwapDebt debt) {
        return new SwapDebtView(
                debt.getId(),
                debt.getDebtor().getId(),
                debt.getDebtor().getName(),
                debt.getCreditor().getId(),
                debt.getCreditor().getName(),
                debt.getOriginSwap().getId(),
                debt.getStatus(),
                debt.getCreatedAt()
        );
    }
}
