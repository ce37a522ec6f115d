package zohomigrator.support;

import zohomigrator.http.HttpCall;
import zohomigrator.http.HttpResult;
import zohomigrator.http.HttpTransport;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Answers calls from a fixed script, in order, and remembers every call.
 * Token endpoint calls are answered separately so scripts only describe API traffic.
 */
public final class ScriptedTransport implements HttpTransport {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<HttpCall> calls = new ArrayList<>();
    private final List<HttpCall> tokenCalls = new ArrayList<>();
    private HttpResult tokenAnswer = new HttpResult(200, "{\"access_token\":\"fresh-token\"}");

    public ScriptedTransport then(int status, String body) {
        script.addLast(new HttpResult(status, body));
        return this;
    }

    public ScriptedTransport thenFail(IOException e) {
        script.addLast(e);
        return this;
    }

    public ScriptedTransport tokenAnswer(int status, String body) {
        tokenAnswer = new HttpResult(status, body);
        return this;
    }

    public List<HttpCall> calls() {
        return calls;
    }

    public List<HttpCall> tokenCalls() {
        return tokenCalls;
    }

    public boolean exhausted() {
        return script.isEmpty();
    }

    @Override
    public HttpResult send(HttpCall call) throws IOException {
        String path = call.uri().getPath();
        if (path.endsWith("/token")) {
            tokenCalls.add(call);
            return tokenAnswer;
        }
        calls.add(call);
        Object next = script.pollFirst();
        if (next == null) {
            throw new AssertionError("Unexpected call: " + call);
        }
        if (next instanceof IOException e) {
            throw e;
        }
        return (HttpResult) next;
    }
}
