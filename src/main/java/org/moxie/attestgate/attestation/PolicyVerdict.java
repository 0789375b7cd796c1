package org.moxie.attestgate.attestation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single policy check.
 * <p>
 * {@code passed} is tri-state: {@code TRUE} and {@code FALSE} are decisions, {@code null} means the
 * policy could not decide. Callers must treat {@code null} as "not proven".
 */
public record PolicyVerdict(@JsonProperty("passed") Boolean passed,
                            @JsonProperty("detail") Map<String, Object> detail)
{
  public PolicyVerdict {
    detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
  }

  public static PolicyVerdict pass(Map<String, Object> detail) {
    return new PolicyVerdict(Boolean.TRUE, detail);
  }

  public static PolicyVerdict fail(Map<String, Object> detail) {
    return new PolicyVerdict(Boolean.FALSE, detail);
  }

  public static PolicyVerdict indeterminate(Map<String, Object> detail) {
    return new PolicyVerdict(null, detail);
  }

  public static PolicyVerdict of(Boolean passed, Map<String, Object> detail) {
    return new PolicyVerdict(passed, detail);
  }

  @JsonIgnore
  public boolean proven() {
    return Boolean.TRUE.equals(passed);
  }

  @JsonIgnore
  public boolean indeterminate() {
    return passed == null;
  }
}
