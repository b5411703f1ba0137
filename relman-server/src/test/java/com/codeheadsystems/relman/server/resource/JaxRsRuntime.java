package com.codeheadsystems.relman.server.resource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.util.concurrent.atomic.AtomicInteger;
import org.mockito.Mockito;

/**
 * Installs a mock JAX-RS RuntimeDelegate so resources can build responses without a container.
 * Responses report whichever status was last set on a builder.
 */
final class JaxRsRuntime {

  private JaxRsRuntime() {
  }

  static void install() {
    AtomicInteger status = new AtomicInteger(Response.Status.OK.getStatusCode());
    RuntimeDelegate delegate = mock(RuntimeDelegate.class);
    Response.ResponseBuilder builder = mock(Response.ResponseBuilder.class, Mockito.RETURNS_SELF);
    Response response = mock(Response.class);

    when(delegate.createResponseBuilder()).thenReturn(builder);
    when(builder.status(any(Response.StatusType.class))).thenAnswer(invocation -> {
      status.set(invocation.<Response.StatusType>getArgument(0).getStatusCode());
      return builder;
    });
    when(builder.status(any(Response.Status.class))).thenAnswer(invocation -> {
      status.set(invocation.<Response.Status>getArgument(0).getStatusCode());
      return builder;
    });
    when(builder.status(anyInt())).thenAnswer(invocation -> {
      status.set(invocation.<Integer>getArgument(0));
      return builder;
    });
    when(builder.status(anyInt(), anyString())).thenAnswer(invocation -> {
      status.set(invocation.<Integer>getArgument(0));
      return builder;
    });
    when(builder.build()).thenReturn(response);
    when(response.getStatus()).thenAnswer(invocation -> status.get());

    RuntimeDelegate.setInstance(delegate);
  }

  static void uninstall() {
    RuntimeDelegate.setInstance(null);
  }

  static int status(Throwable thrown) {
    return ((WebApplicationException) thrown).getResponse().getStatus();
  }
}
