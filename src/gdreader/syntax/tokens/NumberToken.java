package gdreader.syntax.tokens;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.CharSequenceToken;

import java.math.BigInteger;

/**
 * A numeric literal.
 *
 * <ul>
 * <li>decimal <code>123</code>, binary <code>0b1010</code>, hexadecimal <code>0x1F</code></li>
 * <li>float <code>1.5</code>, <code>1.</code>, with an exponent only after the point: <code>1.5e-3</code></li>
 * <li>'_' may follow any digit: <code>1_000_000</code></li>
 * </ul>
 *
 * A leading '-' is never part of the literal.
 */
public final class NumberToken extends CharSequenceToken {

	private NumberType type = NumberType.LONG_DECIMAL;
	private boolean exponent;
	private char last;

	public NumberToken() {
	}

	public NumberType getNumberType() {
		return type;
	}

	@Override
	protected boolean canAppendChar(char c, ReadingState state) {
		boolean accepted = accepts(c);
		if (accepted) {
			last = c;
		}
		return accepted;
	}

	private boolean accepts(char c) {
		int length = sequenceLength();
		if (length == 0) {
			return Chars.isDigit(c);
		}
		if (c == '_') {
			return isDigitOfType(last);
		}
		switch (type) {
			case LONG_DECIMAL:
				if (Chars.isDigit(c)) {
					return true;
				}
				if (length == 1 && last == '0') {
					if (c == 'b' || c == 'B') {
						type = NumberType.LONG_BINARY;
						return true;
					}
					if (c == 'x' || c == 'X') {
						type = NumberType.LONG_HEXADECIMAL;
						return true;
					}
				}
				if (c == '.') {
					type = NumberType.DOUBLE;
					return true;
				}
				return false;
			case LONG_BINARY:
				return c == '0' || c == '1';
			case LONG_HEXADECIMAL:
				return Chars.isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
			case DOUBLE:
				if (Chars.isDigit(c)) {
					return true;
				}
				if (isExponentMark(c) && !exponent && last != '.') {
					exponent = true;
					return true;
				}
				return (c == '+' || c == '-') && isExponentMark(last);
			default:
				return false;
		}
	}

	private boolean isDigitOfType(char c) {
		return Chars.isDigit(c) || (type == NumberType.LONG_HEXADECIMAL && Character.digit(c, 16) >= 0);
	}

	private static boolean isExponentMark(char c) {
		return c == 'e' || c == 'E';
	}

	private String digits() {
		return getSequence().replace("_", "");
	}

	/**
	 * The integer value of a decimal, binary or hexadecimal literal; floats are truncated and values
	 * beyond 64 bits keep their low bits.
	 */
	public long getValueLong() {
		String digits = digits();
		switch (type) {
			case LONG_BINARY:
				return parse(digits.substring(2), 2);
			case LONG_HEXADECIMAL:
				return parse(digits.substring(2), 16);
			case DOUBLE:
				return (long) getValueDouble();
			default:
				return parse(digits, 10);
		}
	}

	private static long parse(String digits, int radix) {
		if (digits.isEmpty()) {
			return 0L;
		}
		return new BigInteger(digits, radix).longValue();
	}

	public double getValueDouble() {
		if (type != NumberType.DOUBLE) {
			return getValueLong();
		}
		String digits = digits();
		// an exponent without digits leaves the mantissa as is
		if (digits.endsWith("+") || digits.endsWith("-")) {
			digits = digits.substring(0, digits.length() - 1);
		}
		if (!digits.isEmpty() && isExponentMark(digits.charAt(digits.length() - 1))) {
			digits = digits.substring(0, digits.length() - 1);
		}
		if (digits.isEmpty() || digits.equals(".")) {
			return 0.0;
		}
		return Double.parseDouble(digits);
	}
}
