package webscan.http;

/**
 * Restores an authenticated session when the target redirects a request to its login page.
 */
public interface ReauthHandler {

    /**
     * Decides whether the response is a redirect to the login page of a target this handler
     * knows how to authenticate against.
     */
    boolean isLoginRedirect(HttpRequest request, HttpResponse response);

    /**
     * Performs the stored login flow and stores the refreshed session cookies.
     *
     * @param client raw transport, bypassing rate limiting and redirect handling
     * @param session session to refresh
     * @return true if the session is authenticated afterwards
     */
    boolean reauthenticate(HttpClient client, SessionState session);
}
