package gdreader.syntax.tokens;

import gdreader.ReaderTestBase;
import gdreader.syntax.expressions.NumberExpression;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class NumberTokenTest extends ReaderTestBase {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"42", NumberType.LONG_DECIMAL, 42L, 42.0},
				{"1_000_000", NumberType.LONG_DECIMAL, 1000000L, 1000000.0},
				{"0x1F", NumberType.LONG_HEXADECIMAL, 31L, 31.0},
				{"0xff_ff", NumberType.LONG_HEXADECIMAL, 65535L, 65535.0},
				{"0b101", NumberType.LONG_BINARY, 5L, 5.0},
				{"3.25", NumberType.DOUBLE, 3L, 3.25},
				{"1.5e3", NumberType.DOUBLE, 1500L, 1500.0},
				{"2.0E-1", NumberType.DOUBLE, 0L, 0.2},
				{"7.", NumberType.DOUBLE, 7L, 7.0},
				{"1.5e", NumberType.DOUBLE, 1L, 1.5},
				{"1.5e-", NumberType.DOUBLE, 1L, 1.5},
		});
	}

	private final String text;
	private final NumberType type;
	private final long longValue;
	private final double doubleValue;

	public NumberTokenTest(String text, NumberType type, long longValue, double doubleValue) {
		this.text = text;
		this.type = type;
		this.longValue = longValue;
		this.doubleValue = doubleValue;
	}

	@Test
	public void testLiteral() {
		NumberToken number = ((NumberExpression) parseExpression(text)).getNumber();
		assertThat(number.getSequence(), is(text));
		assertThat(number.getNumberType(), is(type));
		assertThat(number.getValueLong(), is(longValue));
		assertThat(number.getValueDouble(), is(doubleValue));
	}
}
