package convwaves.physics.impl;

import convwaves.config.BaseCoefficients;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.params.RadiativeFeedback;
import convwaves.exception.UnsupportedModeException;
import convwaves.physics.i.IOperatorBuilder;
import org.ejml.data.ZMatrixRMaj;

/**
 * Ensambla el operador lineal de las ondas acopladas convectivamente (Kuang, 2008) para un
 * número de onda adimensional.
 * <p>
 * Sistema completo (6x6), estado (w1, w2, T1, T2, q, L):
 * <ol>
 * <li>Dos ecuaciones de onda amortiguada que acoplan w con T mediante (c·k)².</li>
 * <li>Dos balances de temperatura: calentamiento convectivo, radiación de T (LW+SW)
 * y radiación de humedad.</li>
 * <li>Un balance de humedad, combinación de los anteriores con los pesos d1, d2.</li>
 * <li>Relajación del calentamiento convectivo L hacia su valor diagnóstico en τL.</li>
 * </ol>
 * Sistema reducido "one-way" (4x4), estado (T1, T2, q, J1): se elimina el acoplamiento de
 * vuelta de T2 imponiendo la relación lineal fija entre los dos modos de temperatura que
 * controla {@code r0}. En este sistema no entra la radiación.
 * <p>
 * Clase sin estado: thread-safe.
 */
public class CoupledWaveOperatorBuilder implements IOperatorBuilder {

    @Override
    public String getName() {
        return "Kuang2008-Linear";
    }

    @Override
    public String getDescription() {
        return "Operador lineal de ondas acopladas convectivamente con retroalimentación radiativa (6x6 / 4x4)";
    }

    @Override
    public ZMatrixRMaj build(double wavenumber, ParameterSet params, OperatorMode mode) {
        if (mode == null) {
            throw new UnsupportedModeException("Modo de operador nulo. Use FULL u ONE_WAY.");
        }
        if (!Double.isFinite(wavenumber)) {
            throw new IllegalArgumentException("Número de onda no finito: " + wavenumber);
        }
        switch (mode) {
            case FULL:
                return buildFull(wavenumber, params.getBase(), params.getRadiative());
            case ONE_WAY:
                return buildOneWay(wavenumber, params.getBase());
            default:
                throw new UnsupportedModeException("Modo de operador no soportado: " + mode);
        }
    }

    // --- SISTEMA COMPLETO (6x6) ---

    private ZMatrixRMaj buildFull(double k, BaseCoefficients p, RadiativeFeedback rad) {
        final double A = 1.0 - 2.0 * p.f() + (p.b2() - p.b1()) / p.F();
        final double B = 1.0 + (p.b2() + p.b1()) / p.F() - A * p.r0();
        requireNonZero(B, "B = 1 + (b2 + b1)/F - A·r0");

        // Filas de temperatura (T1, T2). Columnas: w1, w2, T1, T2, q, L.
        // Los coeficientes Rw se rellenan en el ParameterSet pero no entran en el operador.
        final double[] t1Row = {
                -1.0,
                0.0,
                -1.5 * p.rq() + rad.getRT11(),
                rad.getRT21(),
                p.rq() + rad.getRq1(),
                1.0 + p.r0()
        };
        final double[] t2Row = {
                0.0,
                -1.0,
                1.5 * p.rq() + rad.getRT12(),
                rad.getRT22(),
                -p.rq() + rad.getRq2(),
                1.0 - p.r0()
        };

        final double ck1 = k * p.c1();
        final double ck2 = k * p.c2();
        final double tauL = p.tauL();

        ZMatrixRMaj mat = new ZMatrixRMaj(6, 6);

        // 1. Ondas amortiguadas
        mat.set(0, 0, -p.epsilon(), 0.0);
        mat.set(0, 2, ck1 * ck1, 0.0);
        mat.set(1, 1, -p.epsilon(), 0.0);
        mat.set(1, 3, ck2 * ck2, 0.0);

        // 2. Balances de temperatura
        for (int c = 0; c < 6; c++) {
            mat.set(2, c, t1Row[c], 0.0);
            mat.set(3, c, t2Row[c], 0.0);
        }

        // 3. Humedad: (a1, a2) en las columnas w; -d1·(fila T1) - d2·(fila T2) en el resto
        mat.set(4, 0, p.a1(), 0.0);
        mat.set(4, 1, p.a2(), 0.0);
        for (int c = 2; c < 6; c++) {
            mat.set(4, c, -p.d1() * t1Row[c] - p.d2() * t2Row[c], 0.0);
        }

        // 4. Relajación del calentamiento convectivo
        mat.set(5, 0, p.f() / B / tauL, 0.0);
        mat.set(5, 1, (1.0 - p.f()) / B / tauL, 0.0);
        mat.set(5, 2, -1.5 * A * p.rq() / B / tauL, 0.0);
        mat.set(5, 4, A * p.rq() / B / tauL, 0.0);
        mat.set(5, 5, -1.0 / tauL, 0.0);

        return mat;
    }

    // --- SISTEMA REDUCIDO "ONE-WAY" (4x4) ---

    private ZMatrixRMaj buildOneWay(double k, BaseCoefficients p) {
        final double gamma0 = (1.0 - p.r0()) / (1.0 + p.r0());
        final double gammaQ = (2.0 * p.rq()) / (1.0 + p.r0());
        final double D = p.b1() + p.b2() * gamma0;
        requireNonZero(D, "D = b1 + b2·γ0");

        final double f = p.f();
        final double eps = p.epsilon();
        final double tauL = p.tauL();

        // Coeficientes auxiliares de d/dt (f·T1 + (1-f)·T2). Solo alpha0 y beta0 son complejos.
        final double alpha0Re = f * -eps + 1.5 * gammaQ * (1.0 - f);
        final double alpha0Im = f * -(k * p.c1());
        final double beta0Re = (1.0 - f) * -eps;
        final double beta0Im = (1.0 - f) * -(k * p.c2());
        final double delta0 = -(1.0 - f) * gammaQ;

        // J1_eq = cT1·T1 + cT2·T2 + cq·q + cJ1·J1
        final double cT1Re = (-1.5 * p.b2() * gammaQ - p.F() * alpha0Re) / D;
        final double cT1Im = (-p.F() * alpha0Im) / D;
        final double cT2Re = (-p.F() * beta0Re) / D;
        final double cT2Im = (-p.F() * beta0Im) / D;
        final double cQ = (p.b2() * gammaQ - p.F() * delta0) / D;
        final double cJ1 = (-p.F() * f) / D;

        ZMatrixRMaj mat = new ZMatrixRMaj(4, 4);

        mat.set(0, 0, -eps, -k * p.c1());
        mat.set(0, 3, 1.0, 0.0);

        mat.set(1, 0, 1.5 * gammaQ, 0.0);
        mat.set(1, 1, -eps, -k * p.c2());
        mat.set(1, 2, -gammaQ, 0.0);

        mat.set(2, 0, 1.5 * p.m2() * gammaQ, 0.0);
        mat.set(2, 2, -p.m2() * gammaQ, 0.0);
        mat.set(2, 3, p.m1(), 0.0);

        // dJ1/dt = α·T1 + β·T2 + γ·q + δ·J1
        mat.set(3, 0, cT1Re / tauL, cT1Im / tauL);
        mat.set(3, 1, cT2Re / tauL, cT2Im / tauL);
        mat.set(3, 2, cQ / tauL, 0.0);
        mat.set(3, 3, (cJ1 - 1.0) / tauL, 0.0);

        return mat;
    }

    private static void requireNonZero(double value, String what) {
        if (value == 0.0 || !Double.isFinite(value)) {
            throw new IllegalArgumentException("Parámetros degenerados: " + what + " = " + value);
        }
    }
}
