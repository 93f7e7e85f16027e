package alpha.handlerkit.core;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocks of the servlet request and response.
 */
final class ServletMocks {
    private ServletMocks() {
        // Empty
    }
    
    /**
     * Returns a mocked request.
     * 
     * @param method of request
     * @param uri request URI
     * @param query query string (may be {@code null})
     * @return see JavaDoc
     */
    static HttpServletRequest request(String method, String uri, String query) {
        var req = mock(HttpServletRequest.class);
        when(req.getMethod()).thenReturn(method);
        when(req.getRequestURI()).thenReturn(uri);
        when(req.getQueryString()).thenReturn(query);
        return req;
    }
    
    /**
     * Returns a mocked response with an in-memory body.
     * 
     * @param body output stream of the response
     * @return see JavaDoc
     * @throws IOException never
     */
    static HttpServletResponse response(Body body) throws IOException {
        var rsp = mock(HttpServletResponse.class);
        when(rsp.getOutputStream()).thenReturn(body);
        return rsp;
    }
    
    /**
     * An in-memory response body.
     */
    static final class Body extends ServletOutputStream {
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        
        @Override
        public void write(int b) {
            buf.write(b);
        }
        
        @Override
        public boolean isReady() {
            return true;
        }
        
        @Override
        public void setWriteListener(WriteListener writeListener) {
            throw new UnsupportedOperationException();
        }
        
        String text() {
            return buf.toString(UTF_8);
        }
    }
}
