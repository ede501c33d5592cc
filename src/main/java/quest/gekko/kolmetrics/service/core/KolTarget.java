package quest.gekko.kolmetrics.service.core;

import quest.gekko.kolmetrics.domain.Kol;

public record KolTarget(Long kolId, String handle) {
    public static KolTarget of(final Kol kol) {
        return new KolTarget(kol.getId(), kol.getTwitterHandle());
    }

    @Override
    public String toString() {
        return "kol " + kolId + " (@" + handle + ")";
    }
}
