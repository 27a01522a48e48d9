package webscan.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormExtractorTest {

    private static final String PAGE = "http://example.com/guestbook/";

    @Test
    void testExtractsPostFormWithFields() {
        String html = """
            <html><body>
              <form method="POST" action="/guestbook/sign">
                <input type="text" name="name">
                <input type="hidden" name="csrf" value="t0k3n">
                <textarea name="message">hi</textarea>
                <select name="mood"><option value="ok">ok</option><option value="good" selected>good</option></select>
                <input type="submit" name="send" value="Sign">
                <input type="file" name="avatar">
              </form>
            </body></html>
            """;

        List<DiscoveredForm> forms = FormExtractor.extract(html, PAGE);

        assertEquals(1, forms.size());
        DiscoveredForm form = forms.get(0);
        assertTrue(form.isPost());
        assertEquals("http://example.com/guestbook/sign", form.getAction());
        assertEquals(List.of("name", "csrf", "message", "mood"),
            form.getFields().stream().map(FormField::name).toList());
        assertEquals(Map.of("send", "Sign"), form.getSubmitParameters());

        Map<String, String> defaults = form.defaultValues("test");
        assertEquals("test", defaults.get("name"));
        assertEquals("t0k3n", defaults.get("csrf"));
        assertEquals("hi", defaults.get("message"));
        assertEquals("good", defaults.get("mood"));
        assertEquals("Sign", defaults.get("send"));
    }

    @Test
    void testFormWithoutActionSubmitsToPage() {
        List<DiscoveredForm> forms = FormExtractor.extract("<form><input name=\"q\"></form>", PAGE);

        assertEquals(1, forms.size());
        assertEquals("http://example.com/guestbook", forms.get(0).getAction());
        assertFalse(forms.get(0).isPost());
    }

    @Test
    void testSameFormHasSameSignature() {
        String html = "<form action=\"/search\"><input name=\"q\"></form>";

        DiscoveredForm first = FormExtractor.extract(html, "http://example.com/a").get(0);
        DiscoveredForm second = FormExtractor.extract(html, "http://example.com/b").get(0);

        assertEquals(first.signature(), second.signature());
    }

    @Test
    void testNoFormsInEmptyBody() {
        assertTrue(FormExtractor.extract("", PAGE).isEmpty());
        assertTrue(FormExtractor.extract(null, PAGE).isEmpty());
    }
}
