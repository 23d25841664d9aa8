package com.mimecast.sendeml.config;

import java.util.List;

/**
 * Send settings.
 *
 * <p>Immutable, validated content of one settings file.
 * <br>Safe to share between parallel workers.
 *
 * @see SettingsLoader
 */
public final class Settings {
    private final String smtpHost;
    private final int smtpPort;
    private final String fromAddress;
    private final List<String> toAddresses;
    private final List<String> emlFiles;
    private final boolean updateDate;
    private final boolean updateMessageId;
    private final boolean useParallel;
    private final int timeout;

    /**
     * Constructs a new Settings instance.
     *
     * @param smtpHost        SMTP host.
     * @param smtpPort        SMTP port.
     * @param fromAddress     Envelope sender.
     * @param toAddresses     Envelope recipients in order.
     * @param emlFiles        EML file paths in order.
     * @param updateDate      Replace Date line before sending.
     * @param updateMessageId Replace Message-ID line before sending.
     * @param useParallel     One connection per EML file.
     * @param timeout         Socket read timeout in milliseconds, 0 for none.
     */
    public Settings(String smtpHost, int smtpPort, String fromAddress,
                    List<String> toAddresses, List<String> emlFiles,
                    boolean updateDate, boolean updateMessageId, boolean useParallel, int timeout) {
        this.smtpHost = smtpHost;
        this.smtpPort = smtpPort;
        this.fromAddress = fromAddress;
        this.toAddresses = List.copyOf(toAddresses);
        this.emlFiles = List.copyOf(emlFiles);
        this.updateDate = updateDate;
        this.updateMessageId = updateMessageId;
        this.useParallel = useParallel;
        this.timeout = timeout;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public String getFromAddress() {
        return fromAddress;
    }

    public List<String> getToAddresses() {
        return toAddresses;
    }

    public List<String> getEmlFiles() {
        return emlFiles;
    }

    public boolean isUpdateDate() {
        return updateDate;
    }

    public boolean isUpdateMessageId() {
        return updateMessageId;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public int getTimeout() {
        return timeout;
    }

    /**
     * Copies these settings with a different EML file list.
     *
     * @param files EML file paths.
     * @return Settings instance.
     */
    public Settings withEmlFiles(List<String> files) {
        return new Settings(smtpHost, smtpPort, fromAddress, toAddresses, files,
                updateDate, updateMessageId, useParallel, timeout);
    }

    @Override
    public String toString() {
        return "Settings{" +
                "smtpHost='" + smtpHost + '\'' +
                ", smtpPort=" + smtpPort +
                ", fromAddress='" + fromAddress + '\'' +
                ", toAddresses=" + toAddresses +
                ", emlFiles=" + emlFiles +
                ", updateDate=" + updateDate +
                ", updateMessageId=" + updateMessageId +
                ", useParallel=" + useParallel +
                ", timeout=" + timeout +
                '}';
    }
}
