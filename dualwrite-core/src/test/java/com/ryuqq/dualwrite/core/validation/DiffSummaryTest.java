package com.ryuqq.dualwrite.core.validation;

import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DiffSummary 집계 테스트.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
class DiffSummaryTest {

    private static Payload payload(String name) {
        return Payload.builder().put("name", name).build();
    }

    private static DiffRecord mismatch(String key, String... fields) {
        List<FieldDifference> differences = new ArrayList<>();
        for (String field : fields) {
            differences.add(new FieldDifference(field, "a", "b"));
        }
        return DiffRecord.mismatch(EntityRef.of("product", key), payload("a"), payload("b"), differences);
    }

    @Test
    void of_EmptyList_ReportsZeroPercentage() {
        DiffSummary summary = DiffSummary.of(List.of());

        assertEquals(0, summary.total());
        assertEquals(0.0, summary.syncPercentage());
        assertTrue(summary.commonIssues().isEmpty());
    }

    @Test
    void of_MixedRecords_CountsByClassification() {
        // Given
        List<DiffRecord> diffs = List.of(
            DiffRecord.match(EntityRef.of("product", "p1"), payload("a"), payload("a")),
            DiffRecord.match(EntityRef.of("product", "p2"), null, null),
            mismatch("p3", "price"),
            DiffRecord.missingInSecondary(EntityRef.of("product", "p4"), payload("a")),
            DiffRecord.missingInPrimary(EntityRef.of("product", "p5"), payload("b"))
        );

        // When
        DiffSummary summary = DiffSummary.of(diffs);

        // Then
        assertEquals(5, summary.total());
        assertEquals(2, summary.matches());
        assertEquals(3, summary.mismatches());
        assertEquals(40.0, summary.syncPercentage(), 0.0001);
        assertEquals(1, summary.count(DiffClassification.VALUE_MISMATCH));
        assertEquals(1, summary.count(DiffClassification.MISSING_IN_SECONDARY));
        assertEquals(1, summary.count(DiffClassification.MISSING_IN_PRIMARY));
        assertEquals(2, summary.count(DiffClassification.MATCH));
    }

    @Test
    void of_CommonIssues_SortedByFrequencyThenName() {
        List<DiffRecord> diffs = List.of(
            mismatch("p1", "price", "stock"),
            mismatch("p2", "price", "name"),
            mismatch("p3", "price", "stock")
        );

        DiffSummary summary = DiffSummary.of(diffs);

        assertEquals(List.of("price", "stock", "name"), summary.commonIssues());
        assertEquals(3, summary.fieldDifferenceCounts().get("price"));
    }

    @Test
    void of_CommonIssues_LimitedToTen() {
        List<DiffRecord> diffs = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            diffs.add(mismatch("p" + i, "field_" + (char) ('a' + i)));
        }

        DiffSummary summary = DiffSummary.of(diffs);

        assertEquals(DiffSummary.COMMON_ISSUE_LIMIT, summary.commonIssues().size());
        assertEquals(15, summary.fieldDifferenceCounts().size());
    }

    @Test
    void diffRecord_InconsistentSnapshots_ThrowsException() {
        EntityRef ref = EntityRef.of("product", "p1");

        assertThrows(IllegalArgumentException.class,
            () -> new DiffRecord(ref, payload("a"), null, DiffClassification.MISSING_IN_PRIMARY, List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> DiffRecord.mismatch(ref, payload("a"), payload("b"), List.of()));
    }

    @Test
    void classification_RepairableOnlyForSecondaryGaps() {
        assertTrue(DiffClassification.MISSING_IN_SECONDARY.isRepairable());
        assertTrue(DiffClassification.VALUE_MISMATCH.isRepairable());
        assertFalse(DiffClassification.MISSING_IN_PRIMARY.isRepairable());
        assertFalse(DiffClassification.MATCH.isRepairable());
    }

    @Test
    void plus_PageSummaries_EqualsSummaryOfAllRecords() {
        // Given
        List<DiffRecord> firstPage = List.of(
            DiffRecord.match(EntityRef.of("product", "p1"), payload("a"), payload("a")),
            mismatch("p2", "price", "stock")
        );
        List<DiffRecord> secondPage = List.of(
            mismatch("p3", "price"),
            DiffRecord.missingInPrimary(EntityRef.of("product", "p9"), payload("b"))
        );
        List<DiffRecord> all = new ArrayList<>(firstPage);
        all.addAll(secondPage);

        // When
        DiffSummary merged = DiffSummary.empty()
            .plus(DiffSummary.of(firstPage))
            .plus(DiffSummary.of(secondPage));

        // Then
        assertEquals(DiffSummary.of(all), merged);
        assertEquals(4, merged.total());
        assertEquals(25.0, merged.syncPercentage(), 0.0001);
        assertEquals(List.of("price", "stock"), merged.commonIssues());
    }

    @Test
    void plus_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> DiffSummary.empty().plus(null));
    }
}
