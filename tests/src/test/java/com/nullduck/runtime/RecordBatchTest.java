package com.nullduck.runtime;

import com.nullduck.array.ValidityArray;
import com.nullduck.test.TestBase;
import com.nullduck.test.TestCategories;
import com.nullduck.types.DataTypes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("RecordBatch Tests")
public class RecordBatchTest extends TestBase {

    @Test
    void schemaFollowsColumnOrder() {
        RecordBatch batch = RecordBatch.builder()
            .column("b", ValidityArray.of(DataTypes.UTF8, "x", null))
            .column("a", ValidityArray.of(DataTypes.INT64, 1L, 2L))
            .build();

        assertThat(batch.columnNames()).containsExactly("b", "a");
        assertThat(batch.schema().fieldNames()).containsExactly("b", "a");
        assertThat(batch.schema().lookup("a")).contains(DataTypes.INT64);
        assertThat(batch.length()).isEqualTo(2);
    }

    @Test
    void rejectsColumnsOfDifferentLengths() {
        Map<String, ValidityArray> columns = new LinkedHashMap<>();
        columns.put("a", ValidityArray.of(DataTypes.INT64, 1L, 2L));
        columns.put("b", ValidityArray.of(DataTypes.INT64, 1L));

        assertThatIllegalArgumentException()
            .isThrownBy(() -> RecordBatch.of(columns))
            .withMessage("column 'b' has length 1, expected 2");
    }

    @Test
    void rejectsDuplicateNames() {
        RecordBatch.Builder builder = RecordBatch.builder()
            .column("a", ValidityArray.of(DataTypes.INT64, 1L));

        assertThatIllegalArgumentException()
            .isThrownBy(() -> builder.column("a", ValidityArray.of(DataTypes.INT64, 2L)));
    }

    @Test
    void missingColumn() {
        RecordBatch batch = RecordBatch.builder()
            .column("a", ValidityArray.of(DataTypes.INT64, 1L))
            .build();

        assertThatIllegalArgumentException()
            .isThrownBy(() -> batch.column("z"))
            .withMessageContaining("No column 'z'");
    }

    @Test
    void batchWithoutColumnsHasNoRows() {
        RecordBatch batch = RecordBatch.builder().build();
        assertThat(batch.length()).isZero();
        assertThat(batch.toMap()).isEmpty();
    }

    @Test
    void toMapUsesNullForNullSlots() {
        RecordBatch batch = RecordBatch.builder()
            .column("a", ValidityArray.of(DataTypes.INT64, null, 1L, null))
            .build();

        assertThat(batch.toMap().get("a")).containsExactly(null, 1L, null);
    }

    @Test
    void equalityIsByColumns() {
        RecordBatch one = RecordBatch.builder().column("a", ValidityArray.of(DataTypes.INT64, 1L, null)).build();
        RecordBatch two = RecordBatch.builder().column("a", ValidityArray.of(DataTypes.INT64, 1L, null)).build();
        RecordBatch renamed = RecordBatch.builder().column("b", ValidityArray.of(DataTypes.INT64, 1L, null)).build();

        assertThat(one).isEqualTo(two).hasSameHashCodeAs(two);
        assertThat(one).isNotEqualTo(renamed);
    }
}
