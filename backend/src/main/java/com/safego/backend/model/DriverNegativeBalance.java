package com.safego.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "driver_negative_balances")
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class DriverNegativeBalance extends NegativeBalance {

    @Column(name = "driver_id", nullable = false, length = 64, unique = true)
    private String driverId;

    @Column(name = "total_cash_trips", nullable = false)
    private long totalCashTrips;

    @Override
    public String getOwnerId() {
        return driverId;
    }

    @Override
    public OwnerType getOwnerType() {
        return OwnerType.DRIVER;
    }

    @Override
    public long getTotalCashTransactions() {
        return totalCashTrips;
    }
}
