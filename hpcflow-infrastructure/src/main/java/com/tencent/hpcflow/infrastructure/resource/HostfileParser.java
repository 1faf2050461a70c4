package com.tencent.hpcflow.infrastructure.resource;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * HostfileParser - hostfile 解析
 * <p>
 * 每行一个主机名，忽略空行与 # 注释；行序即节点编号。
 * </p>
 *
 * @author hpcflow
 */
public final class HostfileParser {

    private HostfileParser() {
    }

    public static List<String> parse(String content) {
        List<String> hosts = new ArrayList<>();
        for (String raw : content.split("\\R")) {
            int comment = raw.indexOf('#');
            String line = (comment >= 0 ? raw.substring(0, comment) : raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.chars().anyMatch(Character::isWhitespace)) {
                // mpich 风格的 "host:slots" 之外不接受多列
                throw new ParseException("hostfile", "Malformed hostfile line: '" + raw.trim() + "'");
            }
            hosts.add(line);
        }
        return hosts;
    }

    public static List<String> read(Path hostfile) {
        if (!Files.isRegularFile(hostfile)) {
            throw new NotFoundException("hostfile:" + hostfile, "Hostfile not found: " + hostfile);
        }
        try {
            return parse(Files.readString(hostfile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ParseException("hostfile:" + hostfile, "Failed to read hostfile " + hostfile, e);
        }
    }

    /**
     * 去掉 "host:slots" 中的槽位数
     */
    public static String hostName(String entry) {
        int colon = entry.indexOf(':');
        return colon > 0 ? entry.substring(0, colon) : entry;
    }
}
