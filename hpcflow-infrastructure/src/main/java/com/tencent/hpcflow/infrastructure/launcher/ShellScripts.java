package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.environment.Environment;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ShellScripts - 拼装在节点上执行的 bash 脚本
 *
 * @author hpcflow
 */
public final class ShellScripts {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

    public static final String LOG_DIR = "logs";

    public static final String OUTPUT_DIR = "output";

    private ShellScripts() {
    }

    /**
     * 单引号转义
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /**
     * 用包配置替换命令模板中的 ${参数名}，缺失的参数替换为空串
     */
    public static String render(String template, Map<String, Object> config) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = config.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : quote(String.valueOf(value))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * 加载模块、导出变量并进入工作目录的前导部分
     */
    public static String prelude(Environment environment, String workDir) {
        StringBuilder sb = new StringBuilder("set -o pipefail; ");
        if (environment != null) {
            if (!environment.getModules().isEmpty()) {
                sb.append("if command -v module >/dev/null 2>&1; then module load");
                environment.getModules().forEach(m -> sb.append(' ').append(quote(m)));
                sb.append("; fi; ");
            }
            environment.getVariables().forEach((k, v) ->
                    sb.append("export ").append(k).append('=').append(quote(v)).append("; "));
        }
        sb.append("mkdir -p ").append(quote(workDir + "/" + LOG_DIR)).append(' ')
                .append(quote(workDir + "/" + OUTPUT_DIR)).append(" && cd ").append(quote(workDir));
        return sb.toString();
    }

    /**
     * 运行包命令并把输出同时写入包日志
     */
    public static String packageScript(Environment environment, String workDir, String packageName, String command) {
        return prelude(environment, workDir) + " && { " + command + " ; } 2>&1 | tee "
                + quote(LOG_DIR + "/" + packageName + ".log");
    }

    /**
     * 清理工作目录，按需保留日志或输出
     */
    public static String cleanScript(String workDir, boolean preserveLogs, boolean preserveOutputs) {
        if (preserveLogs && preserveOutputs) {
            return "find " + quote(workDir) + " -mindepth 1 -maxdepth 1 ! -name " + LOG_DIR + " ! -name " + OUTPUT_DIR
                    + " -exec rm -rf {} +";
        }
        if (preserveLogs) {
            return "find " + quote(workDir) + " -mindepth 1 -maxdepth 1 ! -name " + LOG_DIR + " -exec rm -rf {} +";
        }
        if (preserveOutputs) {
            return "find " + quote(workDir) + " -mindepth 1 -maxdepth 1 ! -name " + OUTPUT_DIR + " -exec rm -rf {} +";
        }
        return "rm -rf " + quote(workDir);
    }

    /**
     * 心跳采样：1 分钟负载、核数、MemTotal、MemAvailable 各占一行
     */
    public static String sampleScript() {
        return "cut -d' ' -f1 /proc/loadavg; nproc; awk '/^MemTotal:/ {print $2} /^MemAvailable:/ {print $2}' /proc/meminfo";
    }
}
