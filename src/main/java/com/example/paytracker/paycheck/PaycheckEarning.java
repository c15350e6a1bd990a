package com.example.paytracker.paycheck;

import jakarta.persistence.*;

import java.math.BigDecimal;

@Entity
@Table(name = "paycheck_earnings")
public class PaycheckEarning {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "paycheck_id", nullable = false)
    private Paycheck paycheck;

    @Column(name = "line_type", nullable = false, length = 120)
    private String type;

    @Column(name = "rate", precision = 12, scale = 4)
    private BigDecimal rate;

    @Column(name = "hours_current", precision = 10, scale = 4)
    private BigDecimal hoursCurrent;

    @Column(name = "hours_adjusted", precision = 10, scale = 4)
    private BigDecimal hoursAdjusted;

    @Column(name = "amount_current", precision = 12, scale = 2)
    private BigDecimal amountCurrent;

    @Column(name = "amount_adjusted", precision = 12, scale = 2)
    private BigDecimal amountAdjusted;

    @Column(name = "amount_ytd", precision = 12, scale = 2)
    private BigDecimal amountYtd;

    protected PaycheckEarning() {}

    public PaycheckEarning(Paycheck paycheck, String type) {
        this.paycheck = paycheck;
        this.type = type;
    }

    public EarningsLine toLine() {
        return new EarningsLine(type, rate, hoursCurrent, amountCurrent, amountAdjusted, amountYtd);
    }

    public Long getId() { return id; }
    public Paycheck getPaycheck() { return paycheck; }
    public String getType() { return type; }
    public BigDecimal getRate() { return rate; }
    public void setRate(BigDecimal rate) { this.rate = rate; }
    public BigDecimal getHoursCurrent() { return hoursCurrent; }
    public void setHoursCurrent(BigDecimal hoursCurrent) { this.hoursCurrent = hoursCurrent; }
    public BigDecimal getHoursAdjusted() { return hoursAdjusted; }
    public void setHoursAdjusted(BigDecimal hoursAdjusted) { this.hoursAdjusted = hoursAdjusted; }
    public BigDecimal getAmountCurrent() { return amountCurrent; }
    public void setAmountCurrent(BigDecimal amountCurrent) { this.amountCurrent = amountCurrent; }
    public BigDecimal getAmountAdjusted() { return amountAdjusted; }
    public void setAmountAdjusted(BigDecimal amountAdjusted) { this.amountAdjusted = amountAdjusted; }
    public BigDecimal getAmountYtd() { return amountYtd; }
    public void setAmountYtd(BigDecimal amountYtd) { this.amountYtd = amountYtd; }
}
