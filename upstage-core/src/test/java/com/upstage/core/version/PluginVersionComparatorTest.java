package com.upstage.core.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginVersionComparator 单元测试")
class PluginVersionComparatorTest {

    private final PluginVersionComparator comparator = PluginVersionComparator.INSTANCE;

    @Nested
    @DisplayName("数字段")
    class NumericTests {

        @ParameterizedTest(name = "{0} < {1}")
        @CsvSource({
                "1.0, 2.0",
                "1.9, 1.10",
                "1.0.0, 1.0.1",
                "241.100, 241.14494",
                "1, 1.0.1"
        })
        @DisplayName("较小的版本排在前面")
        void lowerVersionShouldSortFirst(String lower, String higher) {
            assertTrue(comparator.compare(lower, higher) < 0);
            assertTrue(comparator.compare(higher, lower) > 0);
        }

        @Test
        @DisplayName("缺失段视为 0")
        void missingComponentsShouldEqualZero() {
            assertEquals(0, comparator.compare("1.0", "1.0.0"));
            assertEquals(0, comparator.compare("2", "2.0.0.0"));
        }

        @Test
        @DisplayName("前导零不影响数值")
        void leadingZerosShouldBeIgnored() {
            assertEquals(0, comparator.compare("1.01", "1.1"));
        }

        @Test
        @DisplayName("超长数字不溢出")
        void hugeNumbersShouldNotOverflow() {
            assertTrue(comparator.compare("1.99999999999999999999", "1.100000000000000000000") < 0);
        }
    }

    @Nested
    @DisplayName("限定词")
    class QualifierTests {

        @ParameterizedTest(name = "{0} < {1}")
        @CsvSource({
                "1.0-SNAPSHOT, 1.0-alpha",
                "1.0-alpha, 1.0-beta",
                "1.0-beta2, 1.0-rc1",
                "1.0-rc1, 1.0-rc2",
                "1.0-rc1, 1.0",
                "1.0-beta, 1.0.1",
                "1.0-eap, 1.0-rc",
                "1.0-rc, 1.0-custom"
        })
        @DisplayName("预发布版本低于正式版")
        void preReleaseShouldSortBeforeRelease(String lower, String higher) {
            assertTrue(comparator.compare(lower, higher) < 0);
            assertTrue(comparator.compare(higher, lower) > 0);
        }

        @Test
        @DisplayName("release/final/ga 等同于正式版")
        void releaseWordsShouldBeIgnored() {
            assertEquals(0, comparator.compare("1.0-final", "1.0"));
            assertEquals(0, comparator.compare("1.0.RELEASE", "1.0.0"));
            assertEquals(0, comparator.compare("2.1-GA", "2.1"));
        }

        @Test
        @DisplayName("别名与全称等价")
        void aliasesShouldBeEquivalent() {
            assertEquals(0, comparator.compare("1.0-a1", "1.0-alpha1"));
            assertEquals(0, comparator.compare("1.0-B", "1.0-beta"));
        }

        @Test
        @DisplayName("字母与数字交界处切分")
        void shouldSplitAtDigitLetterBoundary() {
            assertEquals(List.of("1", "0", "rc", "1"), PluginVersionComparator.tokenize("1.0rc1"));
            assertEquals(0, comparator.compare("1.0rc1", "1.0-rc-1"));
        }
    }

    @Nested
    @DisplayName("全序性质")
    class OrderTests {

        @Test
        @DisplayName("null 最小")
        void nullShouldSortLowest() {
            assertTrue(comparator.compare(null, "0.0.1") < 0);
            assertTrue(comparator.compare("0.0.1", null) > 0);
            assertEquals(0, comparator.compare(null, null));
        }

        @Test
        @DisplayName("排序结果满足反对称与传递")
        void sortingShouldBeConsistent() {
            List<String> versions = new ArrayList<>(List.of(
                    "2.0", "1.0-rc1", "1.0", "1.0.0-final", "1.0.1", "1.0-SNAPSHOT", "1", "1.0-beta", "0.9"));
            versions.sort(comparator);

            for (int i = 0; i < versions.size(); i++) {
                for (int j = 0; j < versions.size(); j++) {
                    int ij = Integer.signum(comparator.compare(versions.get(i), versions.get(j)));
                    int ji = Integer.signum(comparator.compare(versions.get(j), versions.get(i)));
                    assertEquals(-ij, ji, versions.get(i) + " vs " + versions.get(j));
                    if (i < j) {
                        assertTrue(ij <= 0, versions.get(i) + " should not be above " + versions.get(j));
                    }
                }
            }
            assertEquals("0.9", versions.get(0));
            assertEquals("2.0", versions.get(versions.size() - 1));
        }
    }
}
