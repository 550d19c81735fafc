package org.lokray.scad.evaluation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable OpenSCAD value. Numbers are held as {@link Double}, vectors as lists of results,
 * and {@code undef} carries a {@code null} value.
 */
public final class EvaluationResult
{
	private static final EvaluationResult UNDEF = new EvaluationResult(null, ValueType.UNDEF);
	private static final EvaluationResult TRUE = new EvaluationResult(Boolean.TRUE, ValueType.BOOLEAN);
	private static final EvaluationResult FALSE = new EvaluationResult(Boolean.FALSE, ValueType.BOOLEAN);

	private final Object value;
	private final ValueType type;
	private final List<EvaluationResult> elements;

	private EvaluationResult(Object value, ValueType type)
	{
		this(value, type, List.of());
	}

	private EvaluationResult(Object value, ValueType type, List<EvaluationResult> elements)
	{
		this.value = value;
		this.type = type;
		this.elements = elements;
	}

	public static EvaluationResult number(double value)
	{
		return new EvaluationResult(value, ValueType.NUMBER);
	}

	public static EvaluationResult string(String value)
	{
		return new EvaluationResult(Objects.requireNonNull(value), ValueType.STRING);
	}

	public static EvaluationResult bool(boolean value)
	{
		return value ? TRUE : FALSE;
	}

	public static EvaluationResult vector(List<EvaluationResult> elements)
	{
		List<EvaluationResult> copy = List.copyOf(elements);
		return new EvaluationResult(copy, ValueType.VECTOR, copy);
	}

	public static EvaluationResult numbers(double... values)
	{
		return vector(Arrays.stream(values).mapToObj(EvaluationResult::number).toList());
	}

	public static EvaluationResult undef()
	{
		return UNDEF;
	}

	public Object getValue()
	{
		return value;
	}

	public ValueType getType()
	{
		return type;
	}

	public boolean isUndef()
	{
		return type == ValueType.UNDEF;
	}

	public boolean isNumber()
	{
		return type == ValueType.NUMBER;
	}

	public boolean isString()
	{
		return type == ValueType.STRING;
	}

	public boolean isBoolean()
	{
		return type == ValueType.BOOLEAN;
	}

	public boolean isVector()
	{
		return type == ValueType.VECTOR;
	}

	public Optional<Double> asNumber()
	{
		return isNumber() ? Optional.of((Double) value) : Optional.empty();
	}

	public Optional<String> asString()
	{
		return isString() ? Optional.of((String) value) : Optional.empty();
	}

	public Optional<Boolean> asBoolean()
	{
		return isBoolean() ? Optional.of((Boolean) value) : Optional.empty();
	}

	public List<EvaluationResult> asVector()
	{
		return elements;
	}

	/**
	 * The vector's elements as numbers, or empty when this is not a vector of numbers.
	 */
	public Optional<double[]> asNumberVector()
	{
		if (!isVector())
		{
			return Optional.empty();
		}
		List<EvaluationResult> elements = asVector();
		double[] numbers = new double[elements.size()];
		for (int i = 0; i < numbers.length; i++)
		{
			if (!elements.get(i).isNumber())
			{
				return Optional.empty();
			}
			numbers[i] = (Double) elements.get(i).value;
		}
		return Optional.of(numbers);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof EvaluationResult other))
		{
			return false;
		}
		return type == other.type && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, value);
	}

	@Override
	public String toString()
	{
		return Coercions.toDisplayString(this);
	}
}
