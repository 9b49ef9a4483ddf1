package com.tcpchat.client;

import com.tcpchat.command.CommandProcessor;
import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.FilePayload;
import com.tcpchat.protocol.MessageType;
import com.tcpchat.protocol.Payloads;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Renders frames received from the server and stores incoming files.
 *
 * Files land in the download directory under the last path component of
 * the advertised name only, so a sender cannot write outside of it.
 */
public class ClientMessageHandler extends SimpleChannelInboundHandler<ChatMessage> {

    private static final Logger logger = LoggerFactory.getLogger(ClientMessageHandler.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final PrintStream out;
    private final Path downloadDir;

    private volatile boolean quitAcknowledged;

    public ClientMessageHandler(PrintStream out, Path downloadDir) {
        this.out = out;
        this.downloadDir = downloadDir;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ChatMessage message) {
        MessageType type = message.getType();
        if (type == null) {
            logger.warn("Ignoring frame with unknown type {}", message);
            return;
        }

        switch (type) {
            case TEXT -> printText(message.payloadText());
            case FILE -> receiveFile(message.getPayload());
            case JOIN, LEAVE -> print(message.payloadText());
            case ERROR -> print("[Server Error]: " + message.payloadText());
            case COMMAND -> {
                if (CommandProcessor.QUIT_ACK.equals(message.payloadText())) {
                    logger.info("Quit acknowledged by server. Disconnecting.");
                    quitAcknowledged = true;
                    ctx.close();
                }
            }
        }
    }

    private void printText(String text) {
        if (text.startsWith("[Server]")) {
            print(text);
            return;
        }
        int split = text.indexOf(Payloads.DELIMITER);
        if (split < 0) {
            // Server notices such as the welcome line carry no sender
            print("[Server]: " + text);
        } else {
            print(text.substring(0, split) + ": " + text.substring(split + Payloads.DELIMITER.length()));
        }
    }

    private void receiveFile(byte[] payload) {
        Optional<FilePayload> parsed = FilePayload.parseRelayed(payload);
        if (parsed.isEmpty()) {
            print("[Error]: Received malformed file message.");
            return;
        }
        FilePayload file = parsed.get();
        print(file.getSender() + " sent a file: '" + file.getFileName() + "' (" + file.getSize() + " bytes)");

        try {
            Path saved = save(file);
            out.println("[File saved to: " + saved + "]");
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not save file '{}'", file.getFileName(), e);
            out.println("[Error saving file '" + file.getFileName() + "': " + e.getMessage() + "]");
        }
    }

    /**
     * Writes a received file into the download directory.
     *
     * @return where the file was written
     * @throws IllegalArgumentException if the name has no usable file component
     */
    private Path save(FilePayload file) throws IOException {
        Path name = Path.of(file.getFileName()).getFileName();
        if (name == null || name.toString().isBlank() || name.toString().equals("..")) {
            throw new IllegalArgumentException("unusable file name");
        }
        Files.createDirectories(downloadDir);
        Path target = downloadDir.resolve(name.toString());
        Files.write(target, file.getData());
        return target;
    }

    private void print(String line) {
        out.println("[" + LocalTime.now().format(TIMESTAMP) + "] " + line);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!quitAcknowledged) {
            logger.info("Disconnected from server.");
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Connection to server lost", cause);
        ctx.close();
    }

    public boolean isQuitAcknowledged() {
        return quitAcknowledged;
    }
}
