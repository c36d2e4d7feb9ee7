package io.github.yok.phiguard.security;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.google.common.collect.ImmutableMap;
import io.github.yok.phiguard.config.SecurityConfig;
import io.github.yok.phiguard.exception.ErrorKind;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.Test;

class SecurityHelperTest {

    private final SecurityHelper helper = new SecurityHelper(KeyMaterial.generate());

    @Test
    void decrypt_正常ケース_暗号化結果を指定する_元の平文に戻ること() {
        String plaintext = "SSN 123-45-6789 / 患者メモ";
        EncryptedBlob blob = helper.encrypt(plaintext);

        assertNotEquals(plaintext, blob.getToken());
        assertFalse(blob.getToken().contains("123-45-6789"));
        assertEquals(plaintext, helper.decrypt(blob));
        assertEquals(plaintext, helper.decrypt(blob.getToken()));
    }

    @Test
    void encrypt_正常ケース_同じ平文を2回暗号化する_異なるURLセーフなトークンになること() {
        EncryptedBlob first = helper.encrypt("same");
        EncryptedBlob second = helper.encrypt("same");
        assertNotEquals(first, second);
        assertTrue(first.getToken().matches("[A-Za-z0-9_-]+"));
    }

    @Test
    void decryptBytes_正常ケース_空配列を暗号化する_空配列に戻ること() {
        byte[] restored = helper.decryptBytes(helper.encrypt(new byte[0]));
        assertArrayEquals(new byte[0], restored);
        assertEquals("", helper.decrypt(helper.encrypt("")));
    }

    @Test
    void decrypt_正常ケース_サロゲートペアを含む文字列_元の文字列に戻ること() {
        String plaintext = "Allergy 🥜 peanut";
        assertEquals(plaintext, helper.decrypt(helper.encrypt(plaintext)));
    }

    @Test
    void encrypt_異常ケース_対になっていないサロゲートを含む_VALIDATIONが送出されること() {
        PhiGuardException ex = assertThrows(PhiGuardException.class,
                () -> helper.encrypt("note \uD800 end"));
        assertEquals(ErrorKind.VALIDATION, ex.getKind());
        PhiGuardException trailing = assertThrows(PhiGuardException.class,
                () -> helper.encrypt("tail \uDC00"));
        assertEquals(ErrorKind.VALIDATION, trailing.getKind());
    }

    @Test
    void decrypt_異常ケース_別の鍵で暗号化したトークンを指定する_SECURITYが送出されること() {
        EncryptedBlob foreign = new SecurityHelper(KeyMaterial.generate()).encrypt("secret");
        PhiGuardException ex =
                assertThrows(PhiGuardException.class, () -> helper.decrypt(foreign));
        assertEquals(ErrorKind.SECURITY, ex.getKind());
        assertFalse(ex.getMessage().contains("secret"));
    }

    @Test
    void decrypt_異常ケース_改ざんされたトークンを指定する_SECURITYが送出されること() {
        byte[] raw = Base64.decodeBase64(helper.encrypt("payload").getToken());
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.encodeBase64URLSafeString(raw);

        PhiGuardException ex =
                assertThrows(PhiGuardException.class, () -> helper.decrypt(tampered));
        assertEquals(ErrorKind.SECURITY, ex.getKind());
    }

    @Test
    void decrypt_異常ケース_短すぎるトークンやバージョン違いを指定する_SECURITYが送出されること() {
        assertEquals(ErrorKind.SECURITY, assertThrows(PhiGuardException.class,
                () -> helper.decrypt("AAAA")).getKind());
        assertEquals(ErrorKind.SECURITY, assertThrows(PhiGuardException.class,
                () -> helper.decrypt("#not-a-token#")).getKind());

        byte[] raw = Base64.decodeBase64(helper.encrypt("payload").getToken());
        raw[0] = 0x02;
        PhiGuardException ex = assertThrows(PhiGuardException.class,
                () -> helper.decrypt(Base64.encodeBase64URLSafeString(raw)));
        assertTrue(ex.getMessage().contains("version"));
    }

    @Test
    void encrypt_異常ケース_nullを指定する_VALIDATIONが送出されること() {
        assertEquals(ErrorKind.VALIDATION, assertThrows(PhiGuardException.class,
                () -> helper.encrypt((String) null)).getKind());
        assertEquals(ErrorKind.VALIDATION,
                assertThrows(PhiGuardException.class, () -> helper.decrypt(" ")).getKind());
    }

    @Test
    void constructor_異常ケース_鍵未設定の設定を指定する_SECURITYが送出されること() {
        assertEquals(ErrorKind.SECURITY, assertThrows(PhiGuardException.class,
                () -> SecurityHelper.fromConfig(new SecurityConfig())).getKind());
        assertEquals(ErrorKind.SECURITY,
                assertThrows(PhiGuardException.class, () -> new SecurityHelper(null)).getKind());
    }

    @Test
    void fromConfig_正常ケース_設定の鍵を指定する_同じ鍵で復号できること() {
        KeyMaterial key = KeyMaterial.generate();
        SecurityConfig config = new SecurityConfig();
        config.setEncryptionKey(key.toBase64());

        SecurityHelper fromConfig = SecurityHelper.fromConfig(config);

        assertEquals("x", new SecurityHelper(key).decrypt(fromConfig.encrypt("x")));
        assertEquals(key.fingerprint(), fromConfig.keyFingerprint());
    }

    @Test
    void mask_正常ケース_機微な代入を含むSQLを指定する_2回適用しても結果が変わらないこと() {
        String sql = "UPDATE users SET password = 'hunter2' WHERE ssn = '123-45-6789'";
        String once = helper.mask(sql);
        assertEquals("UPDATE users SET password = '***' WHERE ssn = '***'", once);
        assertEquals(once, helper.mask(once));
    }

    @Test
    void maskPii_正常ケース_既定項目を指定する_末尾4文字のみ残ること() {
        Map<String, Object> row = ImmutableMap.of("patient_id", "TEST_P001",
                "social_security_number", "123-45-6789", "phone_number", "555-0101");

        Map<String, Object> masked = helper.maskPii(row, Collections.emptyList());

        assertEquals("TEST_P001", masked.get("patient_id"));
        assertEquals("*******6789", masked.get("social_security_number"));
        assertEquals("****0101", masked.get("phone_number"));
        assertEquals("123-45-6789", row.get("social_security_number"));
        assertEquals("payload",
                new String(helper.decryptBytes(helper.encrypt(
                        "payload".getBytes(StandardCharsets.UTF_8))), StandardCharsets.UTF_8));
    }
}
