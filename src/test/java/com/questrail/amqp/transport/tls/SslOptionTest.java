package com.questrail.amqp.transport.tls;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SslOptionTest
{
    @Test
    void disabledCarriesNoSettings()
    {
        SslOption ssl = SslOption.disabled();

        assertFalse(ssl.enabled());
        assertTrue(ssl.serverNameOverride().isEmpty());
        assertTrue(ssl.enabledProtocols().isEmpty());
    }

    @Test
    void enabledForVerifiesHostnameByDefault()
    {
        SslOption ssl = SslOption.enabledFor("broker.example");

        assertTrue(ssl.enabled());
        assertTrue(ssl.hostnameVerification());
        assertEquals("broker.example", ssl.serverNameOverride().orElseThrow());
        assertNull(ssl.sslContext());
    }

    @Test
    void enabledProtocolsAreCopied()
    {
        List<String> protocols = new ArrayList<>(List.of("TLSv1.3"));
        SslOption ssl = SslOption.enabledFor("broker").withEnabledProtocols(protocols);
        protocols.add("TLSv1.2");

        assertEquals(List.of("TLSv1.3"), ssl.enabledProtocols());
        assertThrows(UnsupportedOperationException.class, () -> ssl.enabledProtocols().add("SSLv3"));
    }

    @Test
    void withersLeaveOriginalUntouched()
    {
        SslOption base = SslOption.enabledFor("broker");
        SslOption relaxed = base.withHostnameVerification(false);

        assertTrue(base.hostnameVerification());
        assertFalse(relaxed.hostnameVerification());
        assertEquals(base.serverName(), relaxed.serverName());
    }
}
