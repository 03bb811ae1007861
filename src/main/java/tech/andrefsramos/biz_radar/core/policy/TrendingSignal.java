package tech.andrefsramos.biz_radar.core.policy;

import tech.andrefsramos.biz_radar.core.domain.Business;

import java.util.OptionalDouble;

/**
 * Sinal usado pelo detector de tendência.
 *
 * <p>{@link #level(Business)} devolve o valor do sinal para um estabelecimento, ou {@code null}
 * quando o upstream não o expõe. A velocidade é a diferença entre duas varreduras consecutivas;
 * sem valor em qualquer dos lados, não há velocidade e o detector não gera evento.</p>
 */
public interface TrendingSignal {

    String name();

    Double level(Business business);

    default OptionalDouble velocity(Business previous, Business current) {
        if (previous == null || current == null) return OptionalDouble.empty();
        Double before = level(previous);
        Double after = level(current);
        if (before == null || after == null) return OptionalDouble.empty();
        return OptionalDouble.of(after - before);
    }
}
