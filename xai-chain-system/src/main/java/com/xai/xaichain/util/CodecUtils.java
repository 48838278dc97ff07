package com.xai.xaichain.util;

import com.xai.xaichain.exception.RejectReason;
import com.xai.xaichain.exception.ValidationException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 规范二进制编码的读写辅助（小端数值 + VarInt 长度前缀）
 */
public class CodecUtils {

    /**
     * 写入VarInt编码（比特币变量长度整数编码）
     * 格式：<0xfd → 1字节；0xfd-0xffff → 0xfd + 2字节小端；0x10000-0xffffffff → 0xfe + 4字节小端；更大 → 0xff + 8字节小端
     */
    public static void writeVarInt(DataOutputStream dos, long value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不能为负数: " + value);
        }
        if (value < 0xfd) {
            dos.writeByte((int) value);
        } else if (value <= 0xffff) {
            dos.writeByte(0xfd);
            dos.writeShort(Short.reverseBytes((short) value));
        } else if (value <= 0xffffffffL) {
            dos.writeByte(0xfe);
            dos.writeInt(Integer.reverseBytes((int) value));
        } else {
            dos.writeByte(0xff);
            dos.writeLong(Long.reverseBytes(value));
        }
    }

    public static long readVarInt(DataInputStream dis) throws IOException {
        int first = dis.readUnsignedByte();
        if (first < 0xfd) {
            return first;
        } else if (first == 0xfd) {
            return Short.reverseBytes(dis.readShort()) & 0xFFFFL;
        } else if (first == 0xfe) {
            return Integer.reverseBytes(dis.readInt()) & 0xFFFFFFFFL;
        }
        long value = Long.reverseBytes(dis.readLong());
        if (value < 0) {
            throw new ValidationException(RejectReason.MALFORMED, "VarInt超出范围");
        }
        return value;
    }

    /**
     * 读取一个计数值并检查上限
     */
    public static int readCount(DataInputStream dis, int max, String what) throws IOException {
        long count = readVarInt(dis);
        if (count > max) {
            throw new ValidationException(RejectReason.MALFORMED, what + "数量超过上限: " + count);
        }
        return (int) count;
    }

    public static void writeBytes(DataOutputStream dos, byte[] data) throws IOException {
        byte[] bytes = data == null ? new byte[0] : data;
        writeVarInt(dos, bytes.length);
        dos.write(bytes);
    }

    public static byte[] readBytes(DataInputStream dis, int maxLength) throws IOException {
        int length = readCount(dis, maxLength, "字节");
        byte[] data = new byte[length];
        dis.readFully(data);
        return data;
    }

    public static void writeString(DataOutputStream dos, String value) throws IOException {
        writeBytes(dos, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }

    public static String readString(DataInputStream dis, int maxLength) throws IOException {
        return new String(readBytes(dis, maxLength), StandardCharsets.UTF_8);
    }

    public static void writeIntLE(DataOutputStream dos, int value) throws IOException {
        dos.writeInt(Integer.reverseBytes(value));
    }

    public static int readIntLE(DataInputStream dis) throws IOException {
        return Integer.reverseBytes(dis.readInt());
    }

    public static void writeLongLE(DataOutputStream dos, long value) throws IOException {
        dos.writeLong(Long.reverseBytes(value));
    }

    public static long readLongLE(DataInputStream dis) throws IOException {
        return Long.reverseBytes(dis.readLong());
    }

    /**
     * 把解码期间的 IO 异常统一转换为格式错误
     */
    public static ValidationException malformed(String what, IOException e) {
        String message = e instanceof EOFException ? what + "数据被截断" : what + "解码失败: " + e.getMessage();
        return new ValidationException(RejectReason.MALFORMED, message, e);
    }
}
