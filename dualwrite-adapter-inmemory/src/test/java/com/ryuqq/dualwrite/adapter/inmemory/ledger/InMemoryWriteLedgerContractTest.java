package com.ryuqq.dualwrite.adapter.inmemory.ledger;

import com.ryuqq.dualwrite.core.spi.WriteLedger;
import com.ryuqq.dualwrite.testkit.contract.WriteLedgerContract;

/**
 * InMemoryWriteLedger에 대한 WriteLedger 계약 테스트.
 */
class InMemoryWriteLedgerContractTest extends WriteLedgerContract {

    @Override
    protected WriteLedger createLedger() {
        return new InMemoryWriteLedger();
    }
}
