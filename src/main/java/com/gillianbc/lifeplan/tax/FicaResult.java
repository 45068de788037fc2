package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FicaResult {

    @NonNull BigDecimal socialSecurity;
    @NonNull BigDecimal medicare;
    @NonNull BigDecimal total;
}
