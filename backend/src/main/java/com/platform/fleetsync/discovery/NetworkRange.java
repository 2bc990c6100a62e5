package com.platform.fleetsync.discovery;

import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * IPv4 address range to scan.
 * 
 * Accepted forms:
 * <ul>
 *   <li>single address: {@code 192.168.1.20}</li>
 *   <li>CIDR block: {@code 192.168.1.0/24} (network and broadcast excluded below /31)</li>
 *   <li>dash range: {@code 192.168.1.10-192.168.1.40} or {@code 192.168.1.10-40}</li>
 * </ul>
 */
public final class NetworkRange {
    
    private final String expression;
    private final long first;
    private final long last;
    
    private NetworkRange(String expression, long first, long last) {
        this.expression = expression;
        this.first = first;
        this.last = last;
    }
    
    public static NetworkRange parse(String expression, int maxHosts) {
        if (expression == null || expression.isBlank()) {
            throw invalid(expression, "Network range is required");
        }
        String value = expression.trim();
        NetworkRange range;
        
        if (value.contains("/")) {
            range = parseCidr(value);
        } else if (value.contains("-")) {
            range = parseDashRange(value);
        } else {
            long address = toLong(value, value);
            range = new NetworkRange(value, address, address);
        }
        
        if (range.size() > maxHosts) {
            throw invalid(value, "Range covers " + range.size() + " hosts, more than the limit of " + maxHosts);
        }
        return range;
    }
    
    private static NetworkRange parseCidr(String value) {
        String[] parts = value.split("/", 2);
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw invalid(value, "Invalid prefix length '" + parts[1] + "'");
        }
        if (prefix < 0 || prefix > 32) {
            throw invalid(value, "Prefix length must be between 0 and 32");
        }
        long base = toLong(parts[0].trim(), value);
        long mask = prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        long network = base & mask;
        long broadcast = network | (~mask & 0xFFFFFFFFL);
        if (prefix >= 31) {
            return new NetworkRange(value, network, broadcast);
        }
        return new NetworkRange(value, network + 1, broadcast - 1);
    }
    
    private static NetworkRange parseDashRange(String value) {
        String[] parts = value.split("-", 2);
        String start = parts[0].trim();
        String end = parts[1].trim();
        if (!end.contains(".")) {
            end = start.substring(0, start.lastIndexOf('.') + 1) + end;
        }
        long first = toLong(start, value);
        long last = toLong(end, value);
        if (last < first) {
            throw invalid(value, "Range end is before range start");
        }
        return new NetworkRange(value, first, last);
    }
    
    static long toLong(String address, String expression) {
        String[] octets = address.split("\\.", -1);
        if (octets.length != 4) {
            throw invalid(expression, "'" + address + "' is not an IPv4 address");
        }
        long result = 0;
        for (String octet : octets) {
            int part;
            try {
                part = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw invalid(expression, "'" + address + "' is not an IPv4 address");
            }
            if (part < 0 || part > 255 || octet.isEmpty() || octet.length() > 3) {
                throw invalid(expression, "'" + address + "' is not an IPv4 address");
            }
            result = (result << 8) | part;
        }
        return result;
    }
    
    static String toAddress(long value) {
        return ((value >> 24) & 0xFF) + "." + ((value >> 16) & 0xFF) + "." + ((value >> 8) & 0xFF) + "." + (value & 0xFF);
    }
    
    private static ValidationException invalid(String expression, String message) {
        return new ValidationException(ErrorCode.INVALID_NETWORK_RANGE,
            "Invalid network range '" + expression + "': " + message);
    }
    
    public long size() {
        return last - first + 1;
    }
    
    public List<String> addresses() {
        List<String> addresses = new ArrayList<>((int) size());
        for (long value = first; value <= last; value++) {
            addresses.add(toAddress(value));
        }
        return addresses;
    }
    
    @Override
    public String toString() {
        return expression;
    }
}
