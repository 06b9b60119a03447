package dustin.escrow.shared.crypto;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import dustin.escrow.shared.exception.EscrowErrorCode;
import dustin.escrow.shared.exception.EscrowException;

/**
 * 해시 및 바이트 인코딩 유틸리티
 * SHA-256 and fixed-width little-endian encoding helpers
 */
public final class Hashes {

    public static final int HASH_LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private Hashes() {
    }

    public static byte[] sha256(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(data);
        } catch (NoSuchAlgorithmException e) {
            // JCA 필수 알고리즘
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 고정 시간 바이트 비교
     */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        return MessageDigest.isEqual(a, b);
    }

    public static String toHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    /**
     * 32바이트 해시 hex 파싱 (선택적 0x 접두사 허용)
     *
     * @throws EscrowException MALFORMED_HEX - 형식 또는 길이 불일치
     */
    public static byte[] parseHash(String hex, String field) {
        byte[] bytes = parseHex(hex, field);
        if (bytes.length != HASH_LENGTH) {
            throw new EscrowException(EscrowErrorCode.MALFORMED_HEX,
                    field + " must be " + HASH_LENGTH + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    public static byte[] parseHex(String hex, String field) {
        if (hex == null) {
            throw new EscrowException(EscrowErrorCode.MALFORMED_HEX, field + " is required");
        }
        String body = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return HEX.parseHex(body.toLowerCase());
        } catch (IllegalArgumentException e) {
            throw new EscrowException(EscrowErrorCode.MALFORMED_HEX, field + " is not valid hex", e);
        }
    }

    /**
     * 해시 입력 버퍼
     * Builder for hash preimages: fixed-width little-endian integers and length-prefixed strings
     */
    public static final class Preimage {

        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        public Preimage bytes(byte[] value) {
            out.writeBytes(value);
            return this;
        }

        /** u32 LE 길이 + UTF-8 */
        public Preimage identity(String value) {
            byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
            out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(utf8.length).array());
            out.writeBytes(utf8);
            return this;
        }

        public Preimage u64(long value) {
            out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array());
            return this;
        }

        /** u128 LE (16바이트) */
        public Preimage u128(BigInteger value) {
            byte[] be = value.toByteArray();
            byte[] le = new byte[16];
            // toByteArray는 부호 바이트가 앞에 붙을 수 있음
            for (int i = 0; i < 16 && i < be.length; i++) {
                le[i] = be[be.length - 1 - i];
            }
            out.writeBytes(le);
            return this;
        }

        public byte[] digest() {
            return sha256(out.toByteArray());
        }
    }
}
