package me.willkroboth.vmcontrol.vm.guestagent;

/**
 * One {@code guest-file-read} result.
 *
 * @param count Bytes the agent says it read
 * @param bytes The decoded payload
 * @param eof   Whether the end of the file was reached
 */
public record GuestFileRead(int count, byte[] bytes, boolean eof) {
}
