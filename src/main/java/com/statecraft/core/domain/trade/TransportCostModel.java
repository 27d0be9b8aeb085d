package com.statecraft.core.domain.trade;

import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.ResourceDAO;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.world.Province;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

/**
 * {@code cost = weight * distance * baseRate * modeFactor}.
 * Weight counts both sides of the deal; distance is the straight line between the two nations' strongest provinces,
 * 0 when either side has no coordinates.
 */
public class TransportCostModel {

    private final ResourceDAO resources;
    private final ProvinceDAO provinces;
    private final double baseRatePerKgKm;

    public TransportCostModel(ResourceDAO resources, ProvinceDAO provinces, double baseRatePerKgKm) {
        this.resources = resources;
        this.provinces = provinces;
        this.baseRatePerKgKm = baseRatePerKgKm;
    }

    public static double cost(double weightKg, double distance, double baseRate, TransportMode mode) {
        return weightKg * distance * baseRate * mode.factor();
    }

    public TransportEstimate estimate(Connection conn, String fromNation, String toNation,
                                      ResourceMap offered, ResourceMap requested, TransportMode mode) throws SQLException {
        double weight = weightOf(conn, offered) + weightOf(conn, requested);
        double distance = distance(conn, fromNation, toNation);
        return new TransportEstimate(weight, distance, mode, cost(weight, distance, baseRatePerKgKm, mode));
    }

    private double weightOf(Connection conn, ResourceMap goods) throws SQLException {
        double total = 0.0;
        for (Map.Entry<Resource, Double> e : goods.asMap().entrySet()) {
            total += resources.weightKg(conn, e.getKey()) * e.getValue();
        }
        return total;
    }

    private double distance(Connection conn, String a, String b) throws SQLException {
        Optional<Province> pa = provinces.strongest(conn, a);
        Optional<Province> pb = provinces.strongest(conn, b);
        if (pa.isEmpty() || pb.isEmpty() || !pa.get().hasCoordinates() || !pb.get().hasCoordinates()) return 0.0;
        return Math.hypot(pa.get().x() - pb.get().x(), pa.get().y() - pb.get().y());
    }
}
