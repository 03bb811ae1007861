package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.exception.ScanCancelledException;

/*
 * Cancelamento cooperativo de uma varredura. A varredura consulta {@link #checkpoint(String)}
 * entre as fases; ao chamar {@link #enterPointOfNoReturn()} (imediatamente antes do commit)
 * pedidos de cancelamento passam a ser recusados.
 */
public class ScanCancellation {

    private boolean requested;
    private boolean committing;

    public synchronized boolean request() {
        if (committing) return false;
        requested = true;
        return true;
    }

    public synchronized boolean isRequested() {
        return requested;
    }

    public synchronized void checkpoint(String phase) {
        if (requested) throw new ScanCancelledException(phase);
    }

    public synchronized void enterPointOfNoReturn() {
        checkpoint("commit");
        committing = true;
    }
}
