package com.snuffles.ledgerpnl.ledger;

import com.snuffles.ledgerpnl.domain.LedgerRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface LedgerRowMapper {

    @Mapping(target = "totalCosts", source = "totalCosts", defaultValue = "0")
    @Mapping(target = "upstreamStatus", source = "status")
    @Mapping(target = "upstreamPnlConfidence", source = "pnlConfidence")
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "pnlConfidence", ignore = true)
    @Mapping(target = "grossPnl", ignore = true)
    @Mapping(target = "costsAllocated", ignore = true)
    @Mapping(target = "realizedPnl", ignore = true)
    LedgerRow toLedgerRow(LedgerRowRecord record);
}
