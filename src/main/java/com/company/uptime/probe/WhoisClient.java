package com.company.uptime.probe;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.IDN;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Port 43 WHOIS client. The authoritative server of a TLD is discovered once through the
 * IANA referral and cached.
 */
@Component
@Slf4j
public class WhoisClient {

    private static final Pattern REFERRAL_PATTERN =
            Pattern.compile("^\\s*(?:refer|whois):\\s*(\\S+)\\s*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final UptimeProperties.Whois settings;
    private final Map<String, String> serversByTld = new ConcurrentHashMap<>();

    public WhoisClient(UptimeProperties properties) {
        this.settings = properties.getWhois();
    }

    public String lookup(String domainName) {
        String asciiName = toAscii(domainName);
        String server = serverFor(tldOf(asciiName));
        log.debug("WHOIS lookup of {} at {}", asciiName, server);
        return query(server, asciiName);
    }

    String serverFor(String tld) {
        String cached = serversByTld.get(tld);
        if (cached != null) {
            return cached;
        }
        String referral = query(settings.getIanaServer(), tld);
        Matcher matcher = REFERRAL_PATTERN.matcher(referral);
        if (!matcher.find()) {
            throw new ProbeException(ProbeFailureReason.WHOIS_LOOKUP, "No WHOIS server known for ." + tld);
        }
        String server = matcher.group(1).toLowerCase();
        serversByTld.put(tld, server);
        log.info("WHOIS server for .{} is {}", tld, server);
        return server;
    }

    String query(String server, String question) {
        int timeoutMs = settings.getTimeoutMs();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(server, settings.getPort()), timeoutMs);
            socket.setSoTimeout(timeoutMs);

            OutputStream out = socket.getOutputStream();
            out.write((question + "\r\n").getBytes(StandardCharsets.US_ASCII));
            out.flush();

            InputStream in = socket.getInputStream();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);

        } catch (SocketTimeoutException e) {
            throw new ProbeException(ProbeFailureReason.TIMEOUT,
                    "WHOIS server " + server + " did not answer within " + timeoutMs + "ms", e);
        } catch (UnknownHostException e) {
            throw new ProbeException(ProbeFailureReason.DNS_FAILURE, "Cannot resolve WHOIS server " + server, e);
        } catch (IOException e) {
            throw new ProbeException(ProbeFailureReason.WHOIS_LOOKUP,
                    "WHOIS query to " + server + " failed: " + e.getMessage(), e);
        }
    }

    private static String toAscii(String domainName) {
        try {
            return IDN.toASCII(domainName.trim());
        } catch (IllegalArgumentException e) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Invalid domain name: " + domainName, e);
        }
    }

    private static String tldOf(String domainName) {
        int dot = domainName.lastIndexOf('.');
        if (dot < 0 || dot == domainName.length() - 1) {
            throw new ProbeException(ProbeFailureReason.INVALID_TARGET, "Domain name has no TLD: " + domainName);
        }
        return domainName.substring(dot + 1);
    }
}
