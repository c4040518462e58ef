package arrlit;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** The value of a range expression; either bound may be open. */
@AutoValue
public abstract class RangeValue {
  public abstract Optional<Integer> start();

  public abstract Optional<Integer> end();

  public static RangeValue create(Optional<Integer> start, Optional<Integer> end) {
    return new AutoValue_RangeValue(start, end);
  }

  @Override
  public final String toString() {
    return start().map(String::valueOf).orElse("") + ".." + end().map(String::valueOf).orElse("");
  }
}
