package com.nullduck.runtime;

import com.nullduck.array.ValidityArray;
import com.nullduck.test.SampleArrays;
import com.nullduck.test.TestBase;
import com.nullduck.test.TestCategories;
import com.nullduck.types.DataTypes;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDateTime;
import java.util.List;

import static com.nullduck.expression.Functions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArrowInterchange}.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("ArrowInterchange Tests")
public class ArrowInterchangeTest extends TestBase {

    private BufferAllocator allocator;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator();
    }

    @Override
    protected void doTearDown() {
        allocator.close();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.nullduck.test.SampleArrays#oneOfEachType")
    void preservesValuesAndValidity(ValidityArray array) {
        try (FieldVector vector = ArrowInterchange.toVector(array, "c", allocator)) {
            assertThat(vector.getValueCount()).isEqualTo(array.length());
            assertThat(vector.getNullCount()).isEqualTo(array.nullCount());
            assertThat(ArrowInterchange.fromVector(vector)).isEqualTo(array);
        }
    }

    @Test
    void writesNativeArrowValues() {
        ValidityArray array = ValidityArray.of(DataTypes.INT64, null, 1L, null);
        try (FieldVector vector = ArrowInterchange.toVector(array, "input", allocator)) {
            assertThat(vector).isInstanceOf(BigIntVector.class);
            BigIntVector bigInts = (BigIntVector) vector;
            assertThat(bigInts.isNull(0)).isTrue();
            assertThat(bigInts.get(1)).isEqualTo(1L);
            assertThat(vector.getName()).isEqualTo("input");
        }
    }

    @Test
    void stringsAreUtf8() {
        ValidityArray array = ValidityArray.of(DataTypes.UTF8, "ünïcödé", null);
        try (FieldVector vector = ArrowInterchange.toVector(array, "s", allocator)) {
            assertThat(vector).isInstanceOf(VarCharVector.class);
            assertThat(ArrowInterchange.fromVector(vector).get(0)).isEqualTo("ünïcödé");
        }
    }

    @Test
    void timestampsBeforeTheEpoch() {
        LocalDateTime early = LocalDateTime.of(1950, 6, 15, 3, 4, 5, 123_456_000);
        ValidityArray array = ValidityArray.of(DataTypes.TIMESTAMP, early);
        try (FieldVector vector = ArrowInterchange.toVector(array, "ts", allocator)) {
            assertThat(ArrowInterchange.fromVector(vector).get(0)).isEqualTo(early);
        }
    }

    @Test
    void emptyArray() {
        try (FieldVector vector = ArrowInterchange.toVector(ValidityArray.empty(DataTypes.FLOAT64), "f", allocator)) {
            assertThat(vector.getValueCount()).isZero();
            assertThat(ArrowInterchange.fromVector(vector).isEmpty()).isTrue();
        }
    }

    @Test
    void batchThroughVectorSchemaRoot() {
        RecordBatch batch = RecordBatch.builder()
            .column("input", ValidityArray.of(DataTypes.INT64, null, 1L, null))
            .column("label", SampleArrays.withNull(DataTypes.UTF8))
            .build();

        try (VectorSchemaRoot root = ArrowInterchange.toVectorSchemaRoot(batch, allocator)) {
            assertThat(root.getRowCount()).isEqualTo(3);
            assertThat(root.getSchema().getFields()).extracting("name").containsExactly("input", "label");

            RecordBatch copy = ArrowInterchange.fromVectorSchemaRoot(root);
            assertThat(copy).isEqualTo(batch);

            RecordBatch filled = copy.evalExpressionList(List.of(fillNull(col("input"), "backward")));
            assertThat(filled.column("input").toList()).containsExactly(1L, 1L, null);
        }
    }
}
