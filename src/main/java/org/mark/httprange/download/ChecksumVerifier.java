package org.mark.httprange.download;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.mark.httprange.exception.ChecksumMismatchException;

/**
 * 	sha256 校验。比较使用常量时间的 {@link MessageDigest#isEqual(byte[], byte[])}。
 */
public final class ChecksumVerifier {
	
	private static final int SHA256_LENGTH = 32;
	private static final HexFormat HEX = HexFormat.of();
	
	public static byte[] sha256(byte[] content) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(content);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
	
	public static String sha256Hex(byte[] content) {
		return HEX.formatHex(sha256(content));
	}
	
	/**
	 * 	解析期望的摘要，格式不对直接抛出，不用等下载完
	 * @param sha256Hex
	 * @return
	 */
	public static byte[] parseSha256(String sha256Hex) {
		if (sha256Hex == null) {
			throw new IllegalArgumentException("sha256 must not be null");
		}
		byte[] expected;
		try {
			expected = HEX.parseHex(sha256Hex.trim());
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("invalid sha256 hex: " + sha256Hex, e);
		}
		if (expected.length != SHA256_LENGTH) {
			throw new IllegalArgumentException("invalid sha256 length, expect 64 hex chars: " + sha256Hex);
		}
		return expected;
	}
	
	/**
	 * 	校验内容的sha256
	 * @param content
	 * @param sha256Hex
	 * @throws ChecksumMismatchException
	 */
	public static void verify(byte[] content, String sha256Hex) throws ChecksumMismatchException {
		byte[] expected = parseSha256(sha256Hex);
		byte[] actual = sha256(content);
		if (!MessageDigest.isEqual(actual, expected)) {
			throw new ChecksumMismatchException(sha256Hex, HEX.formatHex(actual));
		}
	}
	
	private ChecksumVerifier() {
		
	}
}
