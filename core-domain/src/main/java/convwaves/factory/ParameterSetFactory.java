package convwaves.factory;

import convwaves.config.BaseCoefficients;
import convwaves.domain.params.ExperimentVariant;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.params.RadiativeCoefficientSource;
import convwaves.domain.params.RadiativeCoefficientTable;
import convwaves.domain.params.RadiativeFeedback;
import convwaves.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fábrica de {@link ParameterSet}.
 * <p>
 * Cada {@link ExperimentVariant} tiene asociada una estrategia que decide qué coeficientes
 * radiativos se copian de la tabla externa. Los coeficientes no radiativos son los mismos
 * en todas las variantes. Todo coeficiente poblado se multiplica por {@code radScaling}.
 * <p>
 * La tabla se pide a la fuente como mucho una vez y solo si alguna variante radiativa
 * la necesita.
 */
@Slf4j
public class ParameterSetFactory {

    /**
     * Estrategia de generación de coeficientes radiativos para una variante.
     */
    @FunctionalInterface
    interface RadiativeStrategy {
        RadiativeFeedback generate(RadiativeCoefficientTable table, double scaling);
    }

    private static final Map<ExperimentVariant, RadiativeStrategy> REGISTRY = new EnumMap<>(ExperimentVariant.class);

    static {
        REGISTRY.put(ExperimentVariant.NO_RADIATION, (table, s) -> RadiativeFeedback.NONE);
        REGISTRY.put(ExperimentVariant.MOISTURE_TEMPERATURE,
                (table, s) -> applyMoistureTemperature(RadiativeFeedback.builder(), table, s).build());
        REGISTRY.put(ExperimentVariant.CLOUD,
                (table, s) -> applyCloud(RadiativeFeedback.builder(), table, s).build());
        REGISTRY.put(ExperimentVariant.FULL,
                (table, s) -> applyCloud(applyMoistureTemperature(RadiativeFeedback.builder(), table, s), table, s).build());
    }

    private final BaseCoefficients baseCoefficients;
    private final RadiativeCoefficientSource radiativeSource;
    private RadiativeCoefficientTable cachedTable;

    public ParameterSetFactory(BaseCoefficients baseCoefficients, RadiativeCoefficientSource radiativeSource) {
        this.baseCoefficients = baseCoefficients;
        this.radiativeSource = radiativeSource;
    }

    /**
     * Fábrica sin fuente radiativa: solo puede construir la variante {@link ExperimentVariant#NO_RADIATION}.
     */
    public static ParameterSetFactory withoutRadiation(BaseCoefficients baseCoefficients) {
        return new ParameterSetFactory(baseCoefficients, null);
    }

    /**
     * Construye el conjunto de parámetros para una variante y un factor de escala.
     *
     * @param variant    Variante del experimento.
     * @param radScaling Factor no negativo que multiplica todos los coeficientes radiativos.
     * @return Un {@link ParameterSet} inmutable.
     * @throws ConfigurationException si la variante es nula, el factor es negativo o no finito,
     *                                o la tabla radiativa no está disponible o está incompleta.
     */
    public ParameterSet build(ExperimentVariant variant, double radScaling) {
        if (variant == null) {
            throw new ConfigurationException("La variante de experimento no puede ser nula.");
        }
        if (!Double.isFinite(radScaling) || radScaling < 0.0) {
            throw new ConfigurationException("rad_scaling debe ser un número finito no negativo: " + radScaling);
        }

        RadiativeStrategy strategy = REGISTRY.get(variant);
        RadiativeCoefficientTable table = variant.isRadiativelyActive() ? resolveTable(variant) : null;
        RadiativeFeedback radiative = strategy.generate(table, radScaling);

        log.debug("ParameterSet construido: variante={}, rad_scaling={}", variant, radScaling);
        return ParameterSet.builder()
                .variant(variant)
                .radScaling(radScaling)
                .base(baseCoefficients)
                .radiative(radiative)
                .build();
    }

    public ParameterSet build(String variantTag, double radScaling) {
        return build(ExperimentVariant.fromTag(variantTag), radScaling);
    }

    private synchronized RadiativeCoefficientTable resolveTable(ExperimentVariant variant) {
        if (cachedTable != null) {
            return cachedTable;
        }
        if (radiativeSource == null) {
            throw new ConfigurationException("La variante " + variant.getTag()
                    + " necesita una tabla de coeficientes radiativos y no se configuró ninguna fuente.");
        }
        RadiativeCoefficientTable table;
        try {
            table = radiativeSource.load();
        } catch (IOException e) {
            throw new ConfigurationException("No se pudo leer la tabla de coeficientes radiativos.", e);
        }
        if (table == null) {
            throw new ConfigurationException("La fuente radiativa devolvió una tabla nula.");
        }
        log.info("Tabla de coeficientes radiativos cargada.");
        this.cachedTable = table;
        return table;
    }

    // --- Estrategias ---

    private static RadiativeFeedback.RadiativeFeedbackBuilder applyMoistureTemperature(
            RadiativeFeedback.RadiativeFeedbackBuilder b, RadiativeCoefficientTable t, double s) {
        double[] rt1Lw = require(t.rt1Lw(), "RT1_lw");
        double[] rt1Sw = require(t.rt1Sw(), "RT1_sw");
        double[] rt2Lw = require(t.rt2Lw(), "RT2_lw");
        double[] rt2Sw = require(t.rt2Sw(), "RT2_sw");
        double[] rqLw = require(t.rqLw(), "Rq_lw");
        double[] rqSw = require(t.rqSw(), "Rq_sw");
        return b
                .rt11Lw(rt1Lw[0] * s).rt11Sw(rt1Sw[0] * s)
                .rt12Lw(rt1Lw[1] * s).rt12Sw(rt1Sw[1] * s)
                .rt21Lw(rt2Lw[0] * s).rt21Sw(rt2Sw[0] * s)
                .rt22Lw(rt2Lw[1] * s).rt22Sw(rt2Sw[1] * s)
                .rq1Lw(rqLw[0] * s).rq1Sw(rqSw[0] * s)
                .rq2Lw(rqLw[1] * s).rq2Sw(rqSw[1] * s);
    }

    private static RadiativeFeedback.RadiativeFeedbackBuilder applyCloud(
            RadiativeFeedback.RadiativeFeedbackBuilder b, RadiativeCoefficientTable t, double s) {
        double[] rw1Lw = require(t.rw1Lw(), "Rw1_lw");
        double[] rw1Sw = require(t.rw1Sw(), "Rw1_sw");
        double[] rw2Lw = require(t.rw2Lw(), "Rw2_lw");
        double[] rw2Sw = require(t.rw2Sw(), "Rw2_sw");
        return b
                .rw11Lw(rw1Lw[0] * s).rw11Sw(rw1Sw[0] * s)
                .rw12Lw(rw1Lw[1] * s).rw12Sw(rw1Sw[1] * s)
                .rw21Lw(rw2Lw[0] * s).rw21Sw(rw2Sw[0] * s)
                .rw22Lw(rw2Lw[1] * s).rw22Sw(rw2Sw[1] * s);
    }

    // Dos modos verticales como mínimo
    private static double[] require(double[] field, String name) {
        if (field == null || field.length < 2) {
            throw new ConfigurationException("Campo radiativo '" + name + "' ausente o con menos de 2 modos verticales.");
        }
        return field;
    }
}
