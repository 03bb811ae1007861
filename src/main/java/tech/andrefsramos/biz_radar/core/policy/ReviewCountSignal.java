package tech.andrefsramos.biz_radar.core.policy;

import tech.andrefsramos.biz_radar.core.domain.Business;

/*
 * Total de avaliações recebidas. Limiar expresso em avaliações novas por varredura.
 */
public class ReviewCountSignal implements TrendingSignal {

    @Override
    public String name() {
        return "reviews";
    }

    @Override
    public Double level(Business business) {
        if (business == null || business.totalRatings() == null) return null;
        return business.totalRatings().doubleValue();
    }
}
