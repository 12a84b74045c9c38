package org.javai.contextplatform.benchmark;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Order-insensitive SHA-256 digest of a row set.
 *
 * <p>Column names are ignored and row order does not matter; column order within a row does.
 * Values are canonicalised first: numbers compare by value ({@code 1}, {@code 1.0} and
 * {@code 1.00} digest alike), byte arrays as hex, everything else by {@code toString()}.
 * Each value is tagged and length-prefixed so that no two distinct rows share a canonical form.</p>
 */
public final class ResultDigest {

	private static final char VALUE_SEPARATOR = '\u001f';
	private static final char ROW_SEPARATOR = '\u001e';

	private ResultDigest() {
	}

	public static String of(RowSet rowSet) {
		List<String> canonicalRows = new ArrayList<>(rowSet.size());
		for (List<Object> row : rowSet.rows()) {
			canonicalRows.add(canonicalRow(row));
		}
		Collections.sort(canonicalRows);
		StringBuilder sb = new StringBuilder();
		for (String row : canonicalRows) {
			sb.append(row).append(ROW_SEPARATOR);
		}
		return sha256(sb.toString());
	}

	static String canonicalRow(List<Object> row) {
		StringBuilder sb = new StringBuilder();
		for (Object value : row) {
			if (value == null) {
				sb.append('N');
			} else {
				String canonical = canonicalValue(value);
				sb.append('V').append(canonical.length()).append(':').append(canonical);
			}
			sb.append(VALUE_SEPARATOR);
		}
		return sb.toString();
	}

	static String canonicalValue(Object value) {
		if (value instanceof BigDecimal decimal) {
			return canonicalNumber(decimal);
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return Double.toString(d);
			}
			return canonicalNumber(BigDecimal.valueOf(d));
		}
		if (value instanceof BigInteger || value instanceof Long || value instanceof Integer
				|| value instanceof Short || value instanceof Byte) {
			return canonicalNumber(new BigDecimal(value.toString()));
		}
		if (value instanceof byte[] bytes) {
			return "0x" + HexFormat.of().formatHex(bytes);
		}
		return value.toString();
	}

	private static String canonicalNumber(BigDecimal value) {
		if (value.signum() == 0) {
			return "0";
		}
		return value.stripTrailingZeros().toPlainString();
	}

	static String sha256(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
