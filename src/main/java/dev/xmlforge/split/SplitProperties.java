package dev.xmlforge.split;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults of the split pipeline, bound from {@code xmlforge.split.*}. Validated at startup; the
 * application fails to start when a value is out of range.
 */
@Validated
@ConfigurationProperties(prefix = "xmlforge.split")
public record SplitProperties(
    @DefaultValue("1000") @Min(1) int chunkSize,
    @DefaultValue("*.xml") @NotBlank String pattern,
    @DefaultValue("false") boolean recursive,
    @DefaultValue("chunk") @NotBlank String containerTag,
    @DefaultValue("FAIL") @NotNull SourceErrorPolicy onSourceError) {

  /** Options for a run on {@code matchTag} with every configured default applied. */
  public SplitOptions toOptions(String matchTag) {
    return new SplitOptions(matchTag, chunkSize, pattern, recursive, containerTag, onSourceError);
  }
}
