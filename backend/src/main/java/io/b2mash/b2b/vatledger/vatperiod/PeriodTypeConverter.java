package io.b2mash.b2b.vatledger.vatperiod;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/** Binds {@code periodType} request parameters case-insensitively. */
@Component
public class PeriodTypeConverter implements Converter<String, PeriodType> {

  @Override
  public PeriodType convert(String source) {
    return PeriodType.from(source);
  }
}
