package com.example.paytracker.paycheck;

import jakarta.persistence.*;

import java.math.BigDecimal;

/**
 * Leave balance row of a pay statement; figures are stored as printed, in hours.minutes notation.
 */
@Entity
@Table(name = "paycheck_leave_balances")
public class PaycheckLeaveBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "paycheck_id", nullable = false)
    private Paycheck paycheck;

    @Column(name = "line_type", nullable = false, length = 120)
    private String type;

    @Column(name = "balance_start", precision = 10, scale = 2)
    private BigDecimal balanceStart;

    @Column(name = "earned_current", precision = 10, scale = 2)
    private BigDecimal earnedCurrent;

    @Column(name = "used_current", precision = 10, scale = 2)
    private BigDecimal usedCurrent;

    @Column(name = "balance_end", precision = 10, scale = 2)
    private BigDecimal balanceEnd;

    protected PaycheckLeaveBalance() {}

    public PaycheckLeaveBalance(Paycheck paycheck, String type) {
        this.paycheck = paycheck;
        this.type = type;
    }

    public LeaveLine toLine() {
        return new LeaveLine(type, balanceStart, earnedCurrent, usedCurrent, balanceEnd);
    }

    public Long getId() { return id; }
    public Paycheck getPaycheck() { return paycheck; }
    public String getType() { return type; }
    public BigDecimal getBalanceStart() { return balanceStart; }
    public void setBalanceStart(BigDecimal balanceStart) { this.balanceStart = balanceStart; }
    public BigDecimal getEarnedCurrent() { return earnedCurrent; }
    public void setEarnedCurrent(BigDecimal earnedCurrent) { this.earnedCurrent = earnedCurrent; }
    public BigDecimal getUsedCurrent() { return usedCurrent; }
    public void setUsedCurrent(BigDecimal usedCurrent) { this.usedCurrent = usedCurrent; }
    public BigDecimal getBalanceEnd() { return balanceEnd; }
    public void setBalanceEnd(BigDecimal balanceEnd) { this.balanceEnd = balanceEnd; }
}
