package com.papersim.backend.dto;

import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.model.PaperTransaction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * An account with its positions, orders (newest first) and transaction history (newest first).
 */
@Value
@Builder
public class PaperAccountOverview {
    PaperAccount account;
    List<PaperPosition> positions;
    List<PaperOrder> orders;
    List<PaperTransaction> transactions;
}
