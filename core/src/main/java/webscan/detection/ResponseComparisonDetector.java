package webscan.detection;

import webscan.http.HttpResponse;

/**
 * Strategy that decides by comparing a probe response against the baseline response
 * for the same injection point.
 */
@FunctionalInterface
public interface ResponseComparisonDetector {

    /**
     * @param baseline response to the original parameter value
     * @param probe response with the payload substituted
     * @param payload the payload exactly as it was sent
     */
    DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload);
}
