package rulegen;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class BlockDescriptor {
  public abstract String name();

  public static BlockDescriptor of(String name) {
    return new AutoValue_BlockDescriptor(name);
  }
}
