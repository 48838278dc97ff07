package com.xai.xaichain.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * 哈希、签名与地址工具
 */
@Slf4j
public class CryptoUtil {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    // 地址长度：RIPEMD-160 输出20字节，十六进制40字符
    public static final int ADDRESS_HEX_LENGTH = 40;

    public static class ECDSASigner {

        /**
         * 将字节数组转换为EC公钥对象
         * @param publicKeyBytes X.509编码的公钥字节数组
         */
        public static PublicKey bytesToPublicKey(byte[] publicKeyBytes) {
            try {
                KeyFactory keyFactory = KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
                return keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
            } catch (Exception e) {
                throw new IllegalArgumentException("字节数组转换为公钥失败", e);
            }
        }

        /**
         * 生成ECDSA密钥对（secp256k1曲线）
         */
        public static KeyPair generateKeyPair() {
            try {
                KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
                keyGen.initialize(new ECGenParameterSpec("secp256k1"), new SecureRandom());
                return keyGen.generateKeyPair();
            } catch (Exception e) {
                throw new IllegalStateException("生成密钥对失败", e);
            }
        }

        /**
         * 应用ECDSA签名 - 对原始数据进行签名
         */
        public static byte[] applySignature(PrivateKey privateKey, byte[] data) {
            try {
                Signature dsa = Signature.getInstance("SHA256withECDSA", BouncyCastleProvider.PROVIDER_NAME);
                dsa.initSign(privateKey);
                dsa.update(data);
                return dsa.sign();
            } catch (Exception e) {
                throw new IllegalStateException("应用签名失败", e);
            }
        }

        /**
         * 验证ECDSA签名，公钥或签名格式错误时返回false
         */
        public static boolean verifySignature(byte[] publicKeyBytes, byte[] data, byte[] signature) {
            try {
                PublicKey publicKey = bytesToPublicKey(publicKeyBytes);
                Signature dsa = Signature.getInstance("SHA256withECDSA", BouncyCastleProvider.PROVIDER_NAME);
                dsa.initVerify(publicKey);
                dsa.update(data);
                return dsa.verify(signature);
            } catch (Exception e) {
                log.debug("签名验证异常: {}", e.getMessage());
                return false;
            }
        }
    }

    public static byte[] applySHA256(byte[] data) {
        return DigestUtils.sha256(data);
    }

    /**
     * 双SHA-256
     */
    public static byte[] doubleSHA256(byte[] data) {
        return DigestUtils.sha256(DigestUtils.sha256(data));
    }

    /**
     * RIPEMD-160（依赖BouncyCastle，标准库不默认支持）
     */
    public static byte[] applyRIPEMD160(byte[] data) {
        try {
            return MessageDigest.getInstance("RIPEMD160", BouncyCastleProvider.PROVIDER_NAME).digest(data);
        } catch (Exception e) {
            throw new IllegalStateException("RIPEMD-160算法不可用（需BouncyCastle支持）", e);
        }
    }

    /**
     * 公钥 -> 地址：hex(RIPEMD160(SHA256(公钥)))
     */
    public static String publicKeyToAddress(byte[] publicKeyBytes) {
        return bytesToHex(applyRIPEMD160(applySHA256(publicKeyBytes)));
    }

    public static boolean isValidAddress(String address) {
        if (address == null || address.length() != ADDRESS_HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < address.length(); i++) {
            char c = address.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 字节数组转十六进制字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        return Hex.encodeHexString(bytes);
    }

    /**
     * 十六进制字符串转字节数组
     */
    public static byte[] hexToBytes(String hex) {
        try {
            return Hex.decodeHex(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("无效的十六进制字符串: " + hex, e);
        }
    }
}
