package com.example.paytracker.paycheck;

import java.time.LocalDate;

public record PeriodMeta(LocalDate payDate, LocalDate periodEnding, String agency) {
}
