package com.rebenew.watchParty.syncserver.sync;

/**
 * Mitad cliente del protocolo de sincronización.
 *
 * Cada sync-play / sync-pause / sync-seek lleva el timestamp del servidor (epoch millis) tomado
 * al autorizar el comando. El receptor calcula cuánto lleva el evento en vuelo y desplaza su
 * posición objetivo esa cantidad. Todos los receptores coinciden porque aplican la misma fórmula
 * al mismo par (tiempo, timestamp).
 *
 * Se asume una latencia acotada y más o menos simétrica. Aquí no se mide el RTT: un cliente con
 * el reloj desfasado respecto al servidor queda desplazado en ese desfase.
 */
public final class ClockCompensation {

    private ClockCompensation() {
    }

    /**
     * Segundos entre el timestamp del servidor y la lectura del reloj local.
     * Negativo si el reloj local va por detrás del servidor.
     */
    public static double offsetSeconds(long localNowMillis, long serverTimestampMillis) {
        return (localNowMillis - serverTimestampMillis) / 1000.0;
    }

    /**
     * Posición desde la que reproducir al recibir sync-play.
     */
    public static double playTarget(double currentTime, long serverTimestampMillis, long localNowMillis) {
        return currentTime + offsetSeconds(localNowMillis, serverTimestampMillis);
    }

    /**
     * Posición a la que saltar al recibir sync-seek. Sumar o no el tiempo en vuelo es una
     * convención que deben compartir todos los clientes de la sala.
     */
    public static double seekTarget(double newTime, long serverTimestampMillis, long localNowMillis,
                                    boolean compensate) {
        if (!compensate)
            return newTime;
        return newTime + offsetSeconds(localNowMillis, serverTimestampMillis);
    }

    /**
     * True si un evento de control con timestamp {@code candidate} debe sustituir al aplicado con
     * {@code lastApplied}. Sirve para descartar entregas tardías.
     */
    public static boolean isFresher(long candidate, long lastApplied) {
        return candidate >= lastApplied;
    }
}
