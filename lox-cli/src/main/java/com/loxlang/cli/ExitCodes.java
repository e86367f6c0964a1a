package com.loxlang.cli;

/**
 * 进程退出码（沿用 sysexits.h 的取值）
 */
public final class ExitCodes {

    private ExitCodes() {}

    public static final int OK = 0;
    /** 内部错误（解释器自身的缺陷） */
    public static final int INTERNAL_ERROR = 1;
    /** 命令行用法错误 */
    public static final int USAGE = 64;
    /** 源码有词法或语法错误 */
    public static final int DATA_ERROR = 65;
    /** 脚本文件不存在 */
    public static final int NO_INPUT = 66;
    /** 运行时错误 */
    public static final int SOFTWARE = 70;
    /** 读取脚本时的 I/O 错误 */
    public static final int IO_ERROR = 74;
}
