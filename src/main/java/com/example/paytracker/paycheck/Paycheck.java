package com.example.paytracker.paycheck;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "paychecks")
public class Paycheck {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pay_date", nullable = false, unique = true)
    private LocalDate payDate;

    @Column(name = "period_ending")
    private LocalDate periodEnding;

    @Column(name = "agency", length = 120)
    private String agency;

    @Column(name = "gross_pay", precision = 12, scale = 2)
    private BigDecimal grossPay;

    @Column(name = "total_deductions", precision = 12, scale = 2)
    private BigDecimal totalDeductions;

    @Column(name = "net_pay", precision = 12, scale = 2)
    private BigDecimal netPay;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Paycheck() {}

    public Paycheck(LocalDate payDate, LocalDate periodEnding, String agency) {
        this.payDate = payDate;
        this.periodEnding = periodEnding;
        this.agency = agency;
    }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); }

    public PeriodMeta toPeriodMeta() {
        return new PeriodMeta(payDate, periodEnding, agency);
    }

    public Long getId() { return id; }
    public LocalDate getPayDate() { return payDate; }
    public LocalDate getPeriodEnding() { return periodEnding; }
    public String getAgency() { return agency; }
    public BigDecimal getGrossPay() { return grossPay; }
    public void setGrossPay(BigDecimal grossPay) { this.grossPay = grossPay; }
    public BigDecimal getTotalDeductions() { return totalDeductions; }
    public void setTotalDeductions(BigDecimal totalDeductions) { this.totalDeductions = totalDeductions; }
    public BigDecimal getNetPay() { return netPay; }
    public void setNetPay(BigDecimal netPay) { this.netPay = netPay; }
    public String getRemarks() { return remarks; }
    public void setRemarks(String remarks) { this.remarks = remarks; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
