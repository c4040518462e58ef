package arrlit;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Static type of a value. */
public class ValueType {
  public enum Type {
    INTEGER("int"),
    BOOLEAN("bool"),
    STRING("string"),
    RANGE("range"),
    ARRAY(null);

    private final String keyword;

    Type(String keyword) {
      this.keyword = keyword;
    }
  }

  private static final ValueType INTEGER_TYPE = new ValueType(Type.INTEGER);
  private static final ValueType BOOLEAN_TYPE = new ValueType(Type.BOOLEAN);
  private static final ValueType STRING_TYPE = new ValueType(Type.STRING);
  private static final ValueType RANGE_TYPE = new ValueType(Type.RANGE);

  private static final ImmutableMap<String, ValueType> KEYWORDS =
      ImmutableMap.of(
          Type.INTEGER.keyword, INTEGER_TYPE,
          Type.BOOLEAN.keyword, BOOLEAN_TYPE,
          Type.STRING.keyword, STRING_TYPE,
          Type.RANGE.keyword, RANGE_TYPE);

  public static ValueType integerType() {
    return INTEGER_TYPE;
  }

  public static ValueType booleanType() {
    return BOOLEAN_TYPE;
  }

  public static ValueType stringType() {
    return STRING_TYPE;
  }

  public static ValueType rangeType() {
    return RANGE_TYPE;
  }

  public static ArrayValueType arrayOf(ValueType elementType, int length) {
    return new ArrayValueType(elementType, length);
  }

  // Returns null if 'keyword' does not name a scalar type.
  static ValueType forKeyword(String keyword) {
    return KEYWORDS.get(keyword);
  }

  static ImmutableSet<String> keywords() {
    return KEYWORDS.keySet();
  }

  private final Type type;

  private ValueType(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  public final boolean isInteger() {
    return type == Type.INTEGER;
  }

  public final boolean isArray() {
    return type == Type.ARRAY;
  }

  public ArrayValueType asArray() {
    Preconditions.checkState(isArray(), "not an array: %s", this);
    return (ArrayValueType) this;
  }

  /** Whether a value of this type may populate several slots without an explicit clone. */
  public boolean isDuplicable() {
    return type == Type.INTEGER || type == Type.BOOLEAN;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ValueType)) return false;

    ValueType that = (ValueType) o;
    return this.type == that.type;
  }

  @Override
  public int hashCode() {
    return type.hashCode();
  }

  @Override
  public String toString() {
    return type.keyword;
  }

  public static final class ArrayValueType extends ValueType {
    private final ValueType elementType;
    private final int length;

    private ArrayValueType(ValueType elementType, int length) {
      super(Type.ARRAY);
      Preconditions.checkArgument(length >= 0, "negative length: %s", length);
      this.elementType = elementType;
      this.length = length;
    }

    public ValueType elementType() {
      return elementType;
    }

    public int length() {
      return length;
    }

    @Override
    public boolean isDuplicable() {
      return elementType.isDuplicable();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ArrayValueType)) return false;

      ArrayValueType that = (ArrayValueType) o;
      return this.length == that.length && this.elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(elementType, length);
    }

    @Override
    public String toString() {
      return String.format("[%s; %d]", elementType, length);
    }
  }
}
