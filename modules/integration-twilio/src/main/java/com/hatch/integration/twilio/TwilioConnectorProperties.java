package com.hatch.integration.twilio;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.twilio")
public class TwilioConnectorProperties {
  private boolean enabled = true;
  private String baseUrl = "https://api.twilio.com/2010-04-01";
  private String accountSid = "";
  private String authToken = "";
  private String authTokenFile = "";
  private long timeoutMs = 10000L;
  private Retry retry = new Retry();
  private Polling polling = new Polling();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getAccountSid() {
    return accountSid;
  }

  public void setAccountSid(String accountSid) {
    this.accountSid = accountSid;
  }

  public String getAuthToken() {
    return authToken;
  }

  public void setAuthToken(String authToken) {
    this.authToken = authToken;
  }

  public String getAuthTokenFile() {
    return authTokenFile;
  }

  public void setAuthTokenFile(String authTokenFile) {
    this.authTokenFile = authTokenFile;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Polling getPolling() {
    return polling;
  }

  public void setPolling(Polling polling) {
    this.polling = polling;
  }

  public static class Retry {
    private int maxRetries = 5;
    private long baseBackoffMs = 1000L;
    private long maxBackoffMs = 60000L;
    private boolean jitterEnabled = false;

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getBaseBackoffMs() {
      return baseBackoffMs;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
      this.baseBackoffMs = baseBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }

  public static class Polling {
    private int maxPolls = 5;
    private long baseBackoffMs = 1000L;
    private long maxBackoffMs = 60000L;

    public int getMaxPolls() {
      return maxPolls;
    }

    public void setMaxPolls(int maxPolls) {
      this.maxPolls = maxPolls;
    }

    public long getBaseBackoffMs() {
      return baseBackoffMs;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
      this.baseBackoffMs = baseBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }
  }
}
