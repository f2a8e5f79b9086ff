package com.devstats.core.runtime;

import com.devstats.core.spi.CustomFunction;
import com.devstats.plugins.functions.BuiltinFunction;

import java.util.*;

/** Registro cerrado nombre -> función; se arma una vez y no admite altas posteriores. */
public class CustomFunctionRegistry {
  private final Map<String, CustomFunction> functions;

  public CustomFunctionRegistry(Map<String, CustomFunction> fs) {
    Map<String, CustomFunction> copy = new LinkedHashMap<>();
    for (var en : fs.entrySet()) {
      String name = en.getKey();
      if (name == null || name.isBlank()) throw new IllegalArgumentException("custom function name is blank");
      copy.put(name, Objects.requireNonNull(en.getValue(), "function " + name));
    }
    this.functions = Collections.unmodifiableMap(copy);
  }

  public static CustomFunctionRegistry builtin() {
    Map<String, CustomFunction> fs = new LinkedHashMap<>();
    for (BuiltinFunction f : BuiltinFunction.values()) {
      if (fs.put(f.functionName(), f) != null)
        throw new IllegalStateException("duplicate custom function: " + f.functionName());
    }
    return new CustomFunctionRegistry(fs);
  }

  public Optional<CustomFunction> find(String name) { return Optional.ofNullable(functions.get(name)); }
  public Set<String> names() { return functions.keySet(); }
}
