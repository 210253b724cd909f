// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package chunkvec.util.collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class ChunkedVectorLimitsTest {
    @ParameterizedTest(name = "{displayName} chunkCount = {0}, chunkSize = {1}")
    @CsvSource({"0, 5, 0", "2, 5, 10", "1, 2147483647, 2147483647", "65536, 32768, 2147483647"})
    void capacitySaturatesInsteadOfWrapping(final int chunkCount, final int chunkSize, final int expected) {
        assertThat(ChunkedVector.saturatedCapacity(chunkCount, chunkSize)).isEqualTo(expected);
    }

    @Test
    void capacityOfTwoHugeChunksIsNotNegative() {
        assertThat(ChunkedVector.saturatedCapacity(2, 1 << 30)).isEqualTo(Integer.MAX_VALUE);
        assertThat(ChunkedVector.saturatedCapacity(3, Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void pushIsRefusedOnlyOnceSizeReachesIntegerMaxValue() {
        assertThatCode(() -> ChunkedVector.checkRoomForOneMore(0)).doesNotThrowAnyException();
        assertThatCode(() -> ChunkedVector.checkRoomForOneMore(Integer.MAX_VALUE - 1)).doesNotThrowAnyException();
        assertThatExceptionOfType(OutOfMemoryError.class)
            .isThrownBy(() -> ChunkedVector.checkRoomForOneMore(Integer.MAX_VALUE));
    }
}
