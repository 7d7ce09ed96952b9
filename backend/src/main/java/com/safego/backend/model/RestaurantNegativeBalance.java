package com.safego.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "restaurant_negative_balances")
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class RestaurantNegativeBalance extends NegativeBalance {

    @Column(name = "restaurant_id", nullable = false, length = 64, unique = true)
    private String restaurantId;

    @Column(name = "total_cash_orders", nullable = false)
    private long totalCashOrders;

    @Override
    public String getOwnerId() {
        return restaurantId;
    }

    @Override
    public OwnerType getOwnerType() {
        return OwnerType.RESTAURANT;
    }

    @Override
    public long getTotalCashTransactions() {
        return totalCashOrders;
    }
}
