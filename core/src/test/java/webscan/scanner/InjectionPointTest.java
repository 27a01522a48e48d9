package webscan.scanner;

import org.junit.jupiter.api.Test;
import webscan.http.HttpRequest;
import webscan.model.ParameterLocation;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InjectionPointTest {

    @Test
    void testQueryRequestKeepsParameterOrder() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("id", "1");
        params.put("sort", "asc");

        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/item?id=1&sort=asc")
            .name("id")
            .location(ParameterLocation.QUERY)
            .originalValue("1")
            .parameters(params)
            .build();

        HttpRequest request = point.request("1' OR '1'='1");

        assertEquals("GET", request.getMethod());
        assertEquals("http://example.com/item?id=1%27+OR+%271%27%3D%271&sort=asc", request.getUrl());
        assertEquals("id", request.getTargetParameter().orElseThrow().name());
        assertEquals("http://example.com/item", point.getEndpoint());
    }

    @Test
    void testBaselineRequestUsesOriginalValue() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/item?id=7")
            .name("id")
            .location(ParameterLocation.QUERY)
            .originalValue("7")
            .parameters(Map.of("id", "7"))
            .build();

        assertEquals("http://example.com/item?id=7", point.baselineRequest().getUrl());
    }

    @Test
    void testRawRequestIsNotEncodedAgain() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/search?q=a")
            .name("q")
            .location(ParameterLocation.QUERY)
            .parameters(Map.of("q", "a"))
            .build();

        HttpRequest request = point.rawRequest("%3Cscript%3E");

        assertEquals("http://example.com/search?q=%3Cscript%3E", request.getUrl());
    }

    @Test
    void testPostFormRequestCarriesBody() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("user", "test");
        values.put("comment", "test");

        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/comments")
            .method("post")
            .name("comment")
            .location(ParameterLocation.FORM)
            .parameters(values)
            .build();

        HttpRequest request = point.request("<b>x</b>");

        assertEquals("POST", request.getMethod());
        assertEquals("http://example.com/comments", request.getUrl());
        assertEquals("user=test&comment=%3Cb%3Ex%3C%2Fb%3E", request.getBody());
        assertEquals(HttpRequest.FORM_CONTENT_TYPE, request.getContentType());
    }

    @Test
    void testGetFormRequestUsesQueryString() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/find")
            .method("GET")
            .name("q")
            .location(ParameterLocation.FORM)
            .parameters(Map.of("q", "test"))
            .build();

        HttpRequest request = point.request("x y");

        assertEquals("GET", request.getMethod());
        assertEquals("http://example.com/find?q=x+y", request.getUrl());
        assertFalse(request.hasBody());
    }

    @Test
    void testPathSegmentIsReplaced() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/users/42/profile?tab=1")
            .name("path[2]")
            .location(ParameterLocation.PATH)
            .originalValue("42")
            .pathSegmentIndex(2)
            .build();

        HttpRequest request = point.request("42 AND 1=1");

        assertEquals("http://example.com/users/42%20AND%201%3D1/profile?tab=1", request.getUrl());
    }

    @Test
    void testPathPointRequiresSegmentIndex() {
        InjectionPoint.Builder builder = InjectionPoint.builder()
            .url("http://example.com/users/42")
            .name("path[2]")
            .location(ParameterLocation.PATH);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void testFragmentRequest() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/app#home")
            .name("#fragment")
            .location(ParameterLocation.FRAGMENT)
            .build();

        HttpRequest request = point.request("<img src=x>");

        assertEquals("http://example.com/app#<img src=x>", request.getUrl());
    }

    @Test
    void testKeyIdentifiesPoint() {
        InjectionPoint point = InjectionPoint.builder()
            .url("http://example.com/item?id=1#top")
            .name("id")
            .location(ParameterLocation.QUERY)
            .build();

        assertEquals("GET http://example.com/item QUERY:id", point.key());
    }

    @Test
    void testParseQuery() {
        Map<String, String> params = InjectionPoint.parseQuery("a=1&b=hello+world&c&&a=2&d=%3Cx%3E");

        assertEquals(4, params.size());
        assertEquals("2", params.get("a"));
        assertEquals("hello world", params.get("b"));
        assertEquals("", params.get("c"));
        assertEquals("<x>", params.get("d"));
        assertTrue(InjectionPoint.parseQuery(null).isEmpty());
    }
}
