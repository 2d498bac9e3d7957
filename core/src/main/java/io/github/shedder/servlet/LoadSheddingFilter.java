package io.github.shedder.servlet;

import io.github.shedder.LoadShedder;
import io.github.shedder.engine.Admission;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Servlet filter putting a {@link LoadShedder} in front of the rest of the chain.
 *
 * <p>Each request either passes through untouched, with its latency and concurrency fed back to
 * the shedder once the chain returns or throws, or is answered by the {@link RejectionHandler}
 * without reaching the chain.</p>
 *
 * <p>For asynchronous requests the feedback is deferred until the async cycle completes, times
 * out or fails.</p>
 *
 * <p>The filter owns the shedder: {@link #destroy()} closes it.</p>
 */
public class LoadSheddingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(LoadSheddingFilter.class);

    private final LoadShedder shedder;
    private final RejectionHandler rejectionHandler;

    public LoadSheddingFilter(LoadShedder shedder) {
        this(shedder, RejectionHandler.SERVICE_UNAVAILABLE);
    }

    public LoadSheddingFilter(LoadShedder shedder, RejectionHandler rejectionHandler) {
        if (shedder == null) {
            throw new IllegalArgumentException("LoadShedder cannot be null");
        }
        if (rejectionHandler == null) {
            throw new IllegalArgumentException("RejectionHandler cannot be null");
        }
        this.shedder = shedder;
        this.rejectionHandler = rejectionHandler;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest httpRequest)
                || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        Admission admission = shedder.admit();
        boolean handedOff = false;
        try {
            if (!admission.isAccepted()) {
                if (log.isDebugEnabled()) {
                    log.debug("Shedding {} {} at probability {}",
                        httpRequest.getMethod(), httpRequest.getRequestURI(), shedder.probability());
                }
                rejectionHandler.reject(httpRequest, httpResponse);
                return;
            }
            chain.doFilter(request, response);
            if (httpRequest.isAsyncStarted()) {
                httpRequest.getAsyncContext().addListener(new AdmissionListener(admission));
                handedOff = true;
            }
        } finally {
            if (!handedOff) {
                admission.close();
            }
        }
    }

    @Override
    public void destroy() {
        shedder.close();
    }

    public LoadShedder shedder() {
        return shedder;
    }

    // ============ Inner Classes ============

    private static final class AdmissionListener implements AsyncListener {
        private final Admission admission;

        AdmissionListener(Admission admission) {
            this.admission = admission;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onError(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // Re-dispatched async cycles need the listener again
            event.getAsyncContext().addListener(this);
        }
    }
}
