package com.nullduck.kernel;

import com.nullduck.array.ValidityArray;
import com.nullduck.exception.EvaluationException;
import com.nullduck.exception.LengthMismatchException;
import com.nullduck.test.TestBase;
import com.nullduck.test.TestCategories;
import com.nullduck.types.DataTypes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FillKernels}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FillKernels Tests")
public class FillKernelsTest extends TestBase {

    private static ValidityArray int64(Object... values) {
        return ValidityArray.of(DataTypes.INT64, values);
    }

    private static List<Object> list(Object... values) {
        return Arrays.asList(values);
    }

    // ====================================================================
    // Value fill
    // ====================================================================

    static Stream<Arguments> valueFillCases() {
        return Stream.of(
            Arguments.of("no broadcast", list(1L, 2L, null), list(3L, 3L, 3L), list(1L, 2L, 3L)),
            Arguments.of("broadcast input", list((Object) null), list(3L, 3L, 3L), list(3L, 3L, 3L)),
            Arguments.of("broadcast fill value", list(1L, 2L, null), list(3L), list(1L, 2L, 3L)),
            Arguments.of("empty", list(), list(), list()),
            Arguments.of("scalar fill", list(null, 1L, null), list(999L), list(999L, 1L, 999L)),
            Arguments.of("null fill slot", list(null, 1L, null), list(7L, 8L, null), list(7L, 1L, null))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("valueFillCases")
    void fillValue(String name, List<Object> input, List<Object> fill, List<Object> expected) {
        ValidityArray result = FillKernels.fillValue(
            ValidityArray.fromList(DataTypes.INT64, input),
            ValidityArray.fromList(DataTypes.INT64, fill));

        assertThat(result.dataType()).isEqualTo(DataTypes.INT64);
        assertThat(result.toList()).isEqualTo(expected);
    }

    @Nested
    @DisplayName("Value fill per type")
    class ValueFillPerType {

        @Test
        void nullColumnTakesTheFillType() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.NULL, null, null, null),
                ValidityArray.scalar(DataTypes.UTF8, "a"));
            assertThat(result.dataType()).isEqualTo(DataTypes.UTF8);
            assertThat(result.toList()).containsExactly("a", "a", "a");
        }

        @Test
        void boolColumn() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.BOOLEAN, true, false, null),
                ValidityArray.scalar(DataTypes.BOOLEAN, false));
            assertThat(result.toList()).containsExactly(true, false, false);
        }

        @Test
        void stringColumn() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.UTF8, "a", "b", null),
                ValidityArray.scalar(DataTypes.UTF8, "b"));
            assertThat(result.toList()).containsExactly("a", "b", "b");
        }

        @Test
        void binaryColumn() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.BINARY, new byte[] {'a'}, null, new byte[] {'c'}),
                ValidityArray.scalar(DataTypes.BINARY, new byte[] {'b'}));
            assertThat(result).isEqualTo(
                ValidityArray.of(DataTypes.BINARY, new byte[] {'a'}, new byte[] {'b'}, new byte[] {'c'}));
        }

        @Test
        void floatColumn() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.FLOAT64, -1.0, null, 3.0),
                ValidityArray.scalar(DataTypes.FLOAT64, 0.0));
            assertThat(result.toList()).containsExactly(-1.0, 0.0, 3.0);
        }

        @Test
        void dateColumn() {
            LocalDate fill = LocalDate.of(2022, 1, 1);
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.DATE, LocalDate.of(2024, 5, 1), null, LocalDate.of(2023, 1, 1)),
                ValidityArray.scalar(DataTypes.DATE, fill));
            assertThat(result.toList()).containsExactly(LocalDate.of(2024, 5, 1), fill, LocalDate.of(2023, 1, 1));
        }

        @Test
        void timestampColumn() {
            LocalDateTime fill = LocalDateTime.of(2022, 1, 1, 0, 0);
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.TIMESTAMP, fill, null, LocalDateTime.of(2023, 1, 1, 0, 0)),
                ValidityArray.scalar(DataTypes.TIMESTAMP, fill));
            assertThat(result.toList()).containsExactly(fill, fill, LocalDateTime.of(2023, 1, 1, 0, 0));
        }

        @Test
        void widensToSupertype() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.INT32, 1, null),
                ValidityArray.scalar(DataTypes.FLOAT64, 2.5));
            assertThat(result.dataType()).isEqualTo(DataTypes.FLOAT64);
            assertThat(result.toList()).containsExactly(1.0, 2.5);
        }

        @Test
        void dateFilledFromTimestampBecomesTimestamp() {
            ValidityArray result = FillKernels.fillValue(
                ValidityArray.of(DataTypes.DATE, LocalDate.of(2023, 1, 2), null),
                ValidityArray.scalar(DataTypes.TIMESTAMP, LocalDateTime.of(2020, 6, 1, 8, 0)));
            assertThat(result.dataType()).isEqualTo(DataTypes.TIMESTAMP);
            assertThat(result.toList()).containsExactly(
                LocalDateTime.of(2023, 1, 2, 0, 0), LocalDateTime.of(2020, 6, 1, 8, 0));
        }
    }

    @Nested
    @DisplayName("Value fill errors")
    class ValueFillErrors {

        @Test
        void lengthMismatch() {
            assertThatThrownBy(() -> FillKernels.fillValue(int64(1L, null, 3L), int64(1L, 2L)))
                .isInstanceOf(LengthMismatchException.class)
                .hasMessageContaining("fill_null")
                .satisfies(e -> {
                    LengthMismatchException lme = (LengthMismatchException) e;
                    assertThat(lme.getLeftLength()).isEqualTo(3);
                    assertThat(lme.getRightLength()).isEqualTo(2);
                });
        }

        @Test
        void emptyInputAgainstLongerFill() {
            assertThatThrownBy(() -> FillKernels.fillValue(int64(), int64(1L, 2L)))
                .isInstanceOf(LengthMismatchException.class);
        }

        @Test
        void emptyInputAgainstScalarFill() {
            assertThat(FillKernels.fillValue(int64(), int64(1L)).isEmpty()).isTrue();
        }

        @Test
        void scalarInputAgainstEmptyFill() {
            assertThatThrownBy(() -> FillKernels.fillValue(int64((Object) null), int64()))
                .isInstanceOf(LengthMismatchException.class)
                .satisfies(e -> {
                    LengthMismatchException lme = (LengthMismatchException) e;
                    assertThat(lme.getLeftLength()).isEqualTo(1);
                    assertThat(lme.getRightLength()).isZero();
                });
        }

        @Test
        void incompatibleTypes() {
            assertThatThrownBy(() -> FillKernels.fillValue(
                    ValidityArray.of(DataTypes.UTF8, "a", null),
                    ValidityArray.scalar(DataTypes.INT64, 1L)))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("no common supertype for utf8 and int64");
        }
    }

    // ====================================================================
    // Strategy fill
    // ====================================================================

    static Stream<Arguments> forwardCases() {
        return Stream.of(
            Arguments.of(list(null, 1L, null), list(null, 1L, 1L)),
            Arguments.of(list(1L, null, null), list(1L, 1L, 1L)),
            Arguments.of(list(null, null, null), list(null, null, null)),
            Arguments.of(list(1L, 2L, 3L), list(1L, 2L, 3L)),
            Arguments.of(list(null, 1L, null, 2L, null), list(null, 1L, 1L, 2L, 2L)),
            Arguments.of(list(null, null, 1L, null, 2L, null), list(null, null, 1L, 1L, 2L, 2L)),
            Arguments.of(list(), list()),
            Arguments.of(list((Object) null), list((Object) null)),
            Arguments.of(list(42L), list(42L))
        );
    }

    static Stream<Arguments> backwardCases() {
        return Stream.of(
            Arguments.of(list(null, 1L, null), list(1L, 1L, null)),
            Arguments.of(list(1L, null, null), list(1L, null, null)),
            Arguments.of(list(null, null, null), list(null, null, null)),
            Arguments.of(list(1L, 2L, 3L), list(1L, 2L, 3L)),
            Arguments.of(list(null, 1L, null, 2L, null), list(1L, 1L, 2L, 2L, null)),
            Arguments.of(list(null, null, 1L, null, 2L, null), list(1L, 1L, 1L, 2L, 2L, null)),
            Arguments.of(list(), list()),
            Arguments.of(list((Object) null), list((Object) null)),
            Arguments.of(list(42L), list(42L))
        );
    }

    @ParameterizedTest(name = "forward {0} -> {1}")
    @MethodSource("forwardCases")
    void fillForwardInt(List<Object> input, List<Object> expected) {
        ValidityArray result = FillKernels.fillForward(ValidityArray.fromList(DataTypes.INT64, input));
        assertThat(result.toList()).isEqualTo(expected);
        assertThat(result.dataType()).isEqualTo(DataTypes.INT64);
    }

    @ParameterizedTest(name = "backward {0} -> {1}")
    @MethodSource("backwardCases")
    void fillBackwardInt(List<Object> input, List<Object> expected) {
        ValidityArray result = FillKernels.fillBackward(ValidityArray.fromList(DataTypes.INT64, input));
        assertThat(result.toList()).isEqualTo(expected);
        assertThat(result.dataType()).isEqualTo(DataTypes.INT64);
    }

    @Nested
    @DisplayName("Strategy fill per type")
    class StrategyFillPerType {

        @Test
        void strings() {
            ValidityArray input = ValidityArray.of(DataTypes.UTF8, null, "hello", null, "world", null);
            assertThat(FillKernels.fillForward(input).toList())
                .containsExactly(null, "hello", "hello", "world", "world");
            assertThat(FillKernels.fillBackward(input).toList())
                .containsExactly("hello", "hello", "world", "world", null);
        }

        @Test
        void booleans() {
            assertThat(FillKernels.fillForward(ValidityArray.of(DataTypes.BOOLEAN, false, null, null)).toList())
                .containsExactly(false, false, false);
            assertThat(FillKernels.fillBackward(ValidityArray.of(DataTypes.BOOLEAN, null, true, null)).toList())
                .containsExactly(true, true, null);
        }

        @Test
        void floatsKeepTheirType() {
            ValidityArray input = ValidityArray.of(DataTypes.FLOAT64, null, 1.5, null, 2.7, null);
            ValidityArray forward = FillKernels.fillForward(input);
            ValidityArray backward = FillKernels.fillBackward(input);

            assertThat(forward.toList()).containsExactly(null, 1.5, 1.5, 2.7, 2.7);
            assertThat(backward.toList()).containsExactly(1.5, 1.5, 2.7, 2.7, null);
            assertThat(forward.dataType()).isEqualTo(DataTypes.FLOAT64);
            assertThat(forward.get(1)).isInstanceOf(Double.class);
        }

        @Test
        void nullTypeStaysNull() {
            ValidityArray input = ValidityArray.nulls(DataTypes.NULL, 3);
            assertThat(FillKernels.fillForward(input)).isEqualTo(input);
            assertThat(FillKernels.fillBackward(input)).isEqualTo(input);
        }
    }

    @ParameterizedTest
    @EnumSource(FillStrategy.class)
    void fillWithStrategyDispatches(FillStrategy strategy) {
        ValidityArray input = int64(null, 1L, null);
        ValidityArray expected = strategy == FillStrategy.FORWARD
            ? FillKernels.fillForward(input)
            : FillKernels.fillBackward(input);
        assertThat(FillKernels.fillWithStrategy(input, strategy)).isEqualTo(expected);
    }

    @Test
    void strategyFillDoesNotModifyItsInput() {
        ValidityArray input = int64(null, 1L, null);
        FillKernels.fillForward(input);
        FillKernels.fillBackward(input);
        assertThat(input.toList()).containsExactly(null, 1L, null);
    }

    // ====================================================================
    // NaN fill
    // ====================================================================

    @Nested
    @DisplayName("NaN fill")
    class NanFill {

        @Test
        void float64ReplacesNanAndLeavesNullsAlone() {
            ValidityArray input = ValidityArray.of(DataTypes.FLOAT64, 1.0, null, 3.0, Double.NaN);
            ValidityArray result = FillKernels.fillNan(input, 2.0);

            assertThat(result.dataType()).isEqualTo(DataTypes.FLOAT64);
            assertThat(result.toList()).containsExactly(1.0, null, 3.0, 2.0);
        }

        @Test
        void float32ReplacesNanAndLeavesNullsAlone() {
            ValidityArray input = ValidityArray.of(DataTypes.FLOAT32, 1.0f, null, 3.0f, Float.NaN);
            ValidityArray result = FillKernels.fillNan(input, 2.0);

            assertThat(result.dataType()).isEqualTo(DataTypes.FLOAT32);
            assertThat(result.toList()).containsExactly(1.0f, null, 3.0f, 2.0f);
        }

        @Test
        void integerFillIsConverted() {
            ValidityArray result = FillKernels.fillNan(
                ValidityArray.of(DataTypes.FLOAT64, Double.NaN),
                ValidityArray.scalar(DataTypes.INT64, 7L));
            assertThat(result.toList()).containsExactly(7.0);
        }

        @Test
        void nullFillTurnsNanIntoNull() {
            ValidityArray result = FillKernels.fillNan(
                ValidityArray.of(DataTypes.FLOAT64, Double.NaN, 1.0),
                ValidityArray.scalar(DataTypes.NULL, null));
            assertThat(result.toList()).containsExactly(null, 1.0);
        }

        @Test
        void columnFillUsesMatchingSlot() {
            ValidityArray result = FillKernels.fillNan(
                ValidityArray.of(DataTypes.FLOAT64, Double.NaN, 1.0, Double.NaN),
                ValidityArray.of(DataTypes.FLOAT64, 10.0, 20.0, 30.0));
            assertThat(result.toList()).containsExactly(10.0, 1.0, 30.0);
        }

        @Test
        void emptyInput() {
            assertThat(FillKernels.fillNan(ValidityArray.empty(DataTypes.FLOAT64), 1.0).isEmpty()).isTrue();
        }

        @Test
        void rejectsNonFloatInput() {
            assertThatThrownBy(() -> FillKernels.fillNan(int64(1L), 2.0))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("fill_nan")
                .hasMessageContaining("int64");
        }

        @Test
        void rejectsNonNumericFill() {
            assertThatThrownBy(() -> FillKernels.fillNan(
                    ValidityArray.of(DataTypes.FLOAT64, 1.0),
                    ValidityArray.scalar(DataTypes.UTF8, "x")))
                .isInstanceOf(EvaluationException.class);
        }

        @Test
        void nanFillAndNullFillAreOrthogonal() {
            ValidityArray input = ValidityArray.of(DataTypes.FLOAT64, Double.NaN, null);
            ValidityArray nullFilled = FillKernels.fillValue(input, ValidityArray.scalar(DataTypes.FLOAT64, 0.0));
            assertThat(nullFilled.toList()).containsExactly(Double.NaN, 0.0);
        }
    }

    @Test
    void emptyStrategyFill() {
        ValidityArray empty = ValidityArray.fromList(DataTypes.UTF8, Collections.emptyList());
        assertThat(FillKernels.fillForward(empty).isEmpty()).isTrue();
        assertThat(FillKernels.fillBackward(empty).isEmpty()).isTrue();
    }
}
