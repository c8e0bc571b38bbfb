package io.chunkvault.storage.erasure;

import io.chunkvault.InsufficientShardsException;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Systematic Reed-Solomon coder over GF(2^8).
 *
 * <p>The first k shards hold the (zero padded) payload verbatim; the m parity
 * rows come from a Cauchy matrix, so any k of the k+m shards are enough to
 * rebuild the payload.</p>
 */
public class ErasureCoder {
    private static final int GF_SIZE = 256;
    private static final int PRIMITIVE_POLY = 0x11d;

    private static final int[] EXP = new int[GF_SIZE * 2];
    private static final int[] LOG = new int[GF_SIZE];

    static {
        int x = 1;
        for (int i = 0; i < GF_SIZE - 1; i++) {
            EXP[i] = x;
            EXP[i + GF_SIZE - 1] = x;
            LOG[x] = i;
            x <<= 1;
            if (x >= GF_SIZE) {
                x ^= PRIMITIVE_POLY;
            }
        }
    }

    private final int dataShards;
    private final int parityShards;
    private final int totalShards;

    private final int[][] encodeMatrix;
    // Inverted submatrices keyed by the set of shard rows they were built from.
    private final Map<BitSet, int[][]> decodeMatrices = new ConcurrentHashMap<>();

    public ErasureCoder() {
        this(6, 3);
    }

    public ErasureCoder(int dataShards, int parityShards) {
        if (dataShards < 1 || parityShards < 1) {
            throw new IllegalArgumentException("Must have at least 1 data and 1 parity shard");
        }
        if (dataShards + parityShards > 255) {
            throw new IllegalArgumentException("Total shards cannot exceed 255");
        }

        this.dataShards = dataShards;
        this.parityShards = parityShards;
        this.totalShards = dataShards + parityShards;

        this.encodeMatrix = buildCauchyMatrix();
    }

    public EncodeResult encode(byte[] data) {
        int shardSize = shardSizeFor(data.length);
        byte[] paddedData = Arrays.copyOf(data, shardSize * dataShards);

        byte[][] shards = new byte[totalShards][shardSize];

        for (int i = 0; i < dataShards; i++) {
            System.arraycopy(paddedData, i * shardSize, shards[i], 0, shardSize);
        }

        for (int p = dataShards; p < totalShards; p++) {
            multiplyAccumulate(encodeMatrix[p], shards, shards[p], shardSize);
        }

        return new EncodeResult(shards, shardSize, data.length);
    }

    /**
     * Rebuild the payload from whatever shards are present.
     *
     * @param shards array of length k+m, with {@code null} for lost shards
     */
    public byte[] decode(byte[][] shards, int originalSize, int shardSize) {
        if (shards.length != totalShards) {
            throw new IllegalArgumentException("Expected " + totalShards + " shard slots, got " + shards.length);
        }
        int[] present = new int[totalShards];
        int count = 0;
        for (int i = 0; i < totalShards; i++) {
            if (shards[i] != null) {
                present[count++] = i;
            }
        }
        return decode(shards, Arrays.copyOf(present, count), originalSize, shardSize);
    }

    public byte[] decode(byte[][] shards, int[] presentIndices, int originalSize, int shardSize) {
        if (presentIndices.length < dataShards) {
            throw new InsufficientShardsException(presentIndices.length, dataShards);
        }

        int[] selectedIndices = Arrays.copyOf(presentIndices, dataShards);
        Arrays.sort(selectedIndices);
        byte[][] selectedShards = new byte[dataShards][];
        for (int i = 0; i < dataShards; i++) {
            byte[] shard = shards[selectedIndices[i]];
            if (shard == null || shard.length != shardSize) {
                throw new IllegalArgumentException("Shard " + selectedIndices[i] + " is missing or has the wrong size");
            }
            selectedShards[i] = shard;
        }

        byte[] result = new byte[originalSize];
        if (isIdentitySelection(selectedIndices)) {
            copyDataShards(selectedShards, result, shardSize);
            return result;
        }

        int[][] invMatrix = decodeMatrixFor(selectedIndices);
        byte[][] decoded = new byte[dataShards][shardSize];
        for (int i = 0; i < dataShards; i++) {
            multiplyAccumulate(invMatrix[i], selectedShards, decoded[i], shardSize);
        }

        copyDataShards(decoded, result, shardSize);
        return result;
    }

    public int shardSizeFor(int payloadSize) {
        return (payloadSize + dataShards - 1) / dataShards;
    }

    // target ^= sum(coefficients[s] * sources[s]) over the first k sources
    private void multiplyAccumulate(int[] coefficients, byte[][] sources, byte[] target, int length) {
        for (int s = 0; s < dataShards; s++) {
            int coefficient = coefficients[s];
            if (coefficient == 0) continue;
            byte[] source = sources[s];
            for (int j = 0; j < length; j++) {
                target[j] ^= (byte) mul(coefficient, source[j] & 0xFF);
            }
        }
    }

    private void copyDataShards(byte[][] dataRows, byte[] result, int shardSize) {
        int offset = 0;
        for (int i = 0; i < dataShards && offset < result.length; i++) {
            int toCopy = Math.min(shardSize, result.length - offset);
            System.arraycopy(dataRows[i], 0, result, offset, toCopy);
            offset += toCopy;
        }
    }

    private boolean isIdentitySelection(int[] selectedIndices) {
        for (int i = 0; i < selectedIndices.length; i++) {
            if (selectedIndices[i] != i) return false;
        }
        return true;
    }

    private static int mul(int a, int b) {
        if (a == 0 || b == 0) return 0;
        return EXP[LOG[a] + LOG[b]];
    }

    private static int inverse(int a) {
        if (a == 0) throw new ArithmeticException("Zero has no inverse in GF(2^8)");
        return EXP[(GF_SIZE - 1) - LOG[a]];
    }

    // Identity on top, Cauchy rows 1 / (x_i + y_j) below with x_i = i (i >= k) and y_j = j.
    // Every square submatrix of a Cauchy matrix is invertible.
    private int[][] buildCauchyMatrix() {
        int[][] matrix = new int[totalShards][dataShards];
        for (int i = 0; i < dataShards; i++) {
            matrix[i][i] = 1;
        }
        for (int row = dataShards; row < totalShards; row++) {
            for (int col = 0; col < dataShards; col++) {
                matrix[row][col] = inverse(row ^ col);
            }
        }
        return matrix;
    }

    private int[][] decodeMatrixFor(int[] selectedIndices) {
        BitSet key = new BitSet(totalShards);
        for (int index : selectedIndices) {
            key.set(index);
        }
        return decodeMatrices.computeIfAbsent(key, k -> {
            int[][] rows = new int[dataShards][];
            for (int i = 0; i < dataShards; i++) {
                rows[i] = encodeMatrix[selectedIndices[i]];
            }
            return invert(rows);
        });
    }

    // Gauss-Jordan elimination on [A | I].
    private static int[][] invert(int[][] matrix) {
        int n = matrix.length;
        int[][] aug = new int[n][2 * n];
        for (int r = 0; r < n; r++) {
            System.arraycopy(matrix[r], 0, aug[r], 0, n);
            aug[r][n + r] = 1;
        }

        for (int col = 0; col < n; col++) {
            int pivot = col;
            while (pivot < n && aug[pivot][col] == 0) {
                pivot++;
            }
            if (pivot == n) {
                throw new IllegalArgumentException("Singular decode matrix");
            }
            if (pivot != col) {
                int[] swap = aug[col];
                aug[col] = aug[pivot];
                aug[pivot] = swap;
            }

            int scale = inverse(aug[col][col]);
            for (int c = 0; c < 2 * n; c++) {
                aug[col][c] = mul(aug[col][c], scale);
            }

            for (int r = 0; r < n; r++) {
                int factor = aug[r][col];
                if (r == col || factor == 0) continue;
                for (int c = 0; c < 2 * n; c++) {
                    aug[r][c] ^= mul(factor, aug[col][c]);
                }
            }
        }

        int[][] result = new int[n][n];
        for (int r = 0; r < n; r++) {
            System.arraycopy(aug[r], n, result[r], 0, n);
        }
        return result;
    }

    public int getDataShards() { return dataShards; }
    public int getParityShards() { return parityShards; }
    public int getTotalShards() { return totalShards; }

    public record EncodeResult(byte[][] shards, int shardSize, int originalSize) {}
}
