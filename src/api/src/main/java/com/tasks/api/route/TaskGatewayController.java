package com.tasks.api.route;

import com.tasks.api.infra.Envelope;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP front for {@link TaskRouter}. Accepts any method under {@code /tasks} and leaves route
 * matching to the router, so unsupported combinations get the router's 404 envelope.
 */
@RestController
@RequiredArgsConstructor
public class TaskGatewayController {

  private final TaskRouter router;

  @RequestMapping(path = {"/tasks", "/tasks/**"})
  public ResponseEntity<String> handle(HttpServletRequest httpReq,
                                       HttpServletResponse httpResp,
                                       @RequestParam Map<String, String> query,
                                       @RequestBody(required = false) String body) {
    String path = httpReq.getRequestURI().substring(httpReq.getContextPath().length());
    TaskRequest req = TaskRequest.fromHttp(httpReq.getMethod(), path, query, body);

    Envelope envelope = router.handle(req);

    // CORS processing may already have set Access-Control-Allow-Origin; a second value breaks browsers
    HttpHeaders headers = new HttpHeaders();
    envelope.headers().forEach((name, value) -> {
      if (!httpResp.containsHeader(name)) {
        headers.set(name, value);
      }
    });
    return ResponseEntity.status(envelope.statusCode()).headers(headers).body(envelope.body());
  }
}
