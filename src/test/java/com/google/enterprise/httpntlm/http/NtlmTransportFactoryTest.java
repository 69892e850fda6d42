// Copyright 2012 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.httpntlm.http;

import com.google.common.collect.Lists;
import com.google.enterprise.httpntlm.ntlmssp.NtlmEngine;
import com.google.enterprise.httpntlm.ntlmssp.NtlmSspEngine;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import java.io.IOException;
import junit.framework.TestCase;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.BasicCookieStore;

/**
 * Tests for {@link NtlmTransportFactory} and its Guice wiring.
 */
public final class NtlmTransportFactoryTest extends TestCase {
  private static final NtlmCredentials CREDENTIALS =
      NtlmCredentials.make("MYDOMAIN", "mememe", "mineminemine", null);

  public void testDefaultBindings()
      throws IOException {
    Injector injector = Guice.createInjector(new HttpNtlmGuiceModule());
    HttpTransport httpTransport = injector.getInstance(HttpTransport.class);
    try {
      assertTrue(httpTransport instanceof HttpClientTransport);
      assertSame(httpTransport, injector.getInstance(HttpTransport.class));
      assertTrue(injector.getInstance(NtlmEngine.class) instanceof NtlmSspEngine);
      NtlmTransportFactory factory = injector.getInstance(NtlmTransportFactory.class);
      assertSame(factory, injector.getInstance(NtlmTransportFactory.class));
      assertEquals(CREDENTIALS, factory.make(CREDENTIALS).getCredentials());
    } finally {
      ((HttpClientTransport) httpTransport).close();
    }
  }

  public void testTransportsShareInnerTransport()
      throws IOException {
    final MockHttpTransport inner = new MockHttpTransport(Lists.<String>newArrayList());
    final FakeNtlmEngine engine = new FakeNtlmEngine();
    Injector injector = Guice.createInjector(
        Modules.override(new HttpNtlmGuiceModule()).with(
            new AbstractModule() {
              @Override
              protected void configure() {
                bind(HttpTransport.class).toInstance(inner);
                bind(NtlmEngine.class).toInstance(engine);
              }
            }));
    NtlmTransportFactory factory = injector.getInstance(NtlmTransportFactory.class);
    inner.respond(200, "one");
    inner.respond(200, "two");
    factory.make(CREDENTIALS).execute(new HttpGet("http://ntlm.example.com/"));
    factory.make(CREDENTIALS, new BasicCookieStore())
        .execute(new HttpGet("http://ntlm.example.com/"));
    assertEquals(2, inner.getSent().size());
  }
}
