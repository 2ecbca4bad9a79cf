// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.rocksdb.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.Test;

/**
 * Behaviour every {@link Env} has to share. Subclasses provide the env and
 * a directory to work in.
 */
public abstract class AbstractEnvTest {

  protected abstract Env env();

  protected abstract String root();

  @Test
  public void writeAndRead() throws RocksDBException {
    final String file = root() + "/000010.sst";
    FakeBackupableDB.write(env(), file, "hello");

    assertThat(env().fileExists(file)).isTrue();
    assertThat(env().getFileSize(file)).isEqualTo(5);
    assertThat(FakeBackupableDB.read(env(), file)).isEqualTo("hello");

    // rewriting truncates
    FakeBackupableDB.write(env(), file, "hi");
    assertThat(FakeBackupableDB.read(env(), file)).isEqualTo("hi");
  }

  @Test
  public void readReturnsZeroAtEof() throws RocksDBException {
    final String file = root() + "/CURRENT";
    FakeBackupableDB.write(env(), file, "abc");
    final byte[] buf = new byte[8];
    try (final SequentialFile in = env().newSequentialFile(file)) {
      assertThat(in.read(buf, 0, 8)).isEqualTo(3);
      assertThat(in.read(buf, 0, 8)).isEqualTo(0);
    }
  }

  @Test
  public void missingFiles() throws RocksDBException {
    final String file = root() + "/missing";
    assertThat(env().fileExists(file)).isFalse();
    assertNotFound(() -> env().getFileSize(file));
    assertNotFound(() -> env().newSequentialFile(file));
    assertNotFound(() -> env().deleteFile(file));
    assertNotFound(() -> env().getChildren(file));
  }

  @Test
  public void directories() throws RocksDBException {
    final String dir = root() + "/meta";
    env().createDir(dir);
    assertThat(env().fileExists(dir)).isTrue();
    assertThatThrownBy(() -> env().createDir(dir))
        .isInstanceOf(RocksDBException.class);
    env().createDirIfMissing(dir);
    env().createDirIfMissing(root() + "/a/b/c");
    assertThat(env().fileExists(root() + "/a/b")).isTrue();

    FakeBackupableDB.write(env(), dir + "/1", "x");
    FakeBackupableDB.write(env(), dir + "/2", "y");
    assertThat(env().getChildren(dir)).containsExactlyInAnyOrder("1", "2");
    assertThat(env().getChildren(root())).contains("meta", "a");

    assertThatThrownBy(() -> env().deleteDir(dir))
        .isInstanceOf(RocksDBException.class);
    env().deleteFile(dir + "/1");
    env().deleteFile(dir + "/2");
    env().deleteDir(dir);
    assertThat(env().fileExists(dir)).isFalse();
  }

  @Test
  public void renameFile() throws RocksDBException {
    final String src = root() + "/LATEST_BACKUP.tmp";
    final String dst = root() + "/LATEST_BACKUP";
    FakeBackupableDB.write(env(), dst, "1\n");
    FakeBackupableDB.write(env(), src, "2\n");

    env().renameFile(src, dst);

    assertThat(env().fileExists(src)).isFalse();
    assertThat(FakeBackupableDB.read(env(), dst)).isEqualTo("2\n");
  }

  @Test
  public void renameDirectory() throws RocksDBException {
    env().createDirIfMissing(root() + "/private/1.tmp");
    FakeBackupableDB.write(env(), root() + "/private/1.tmp/CURRENT", "c");

    env().renameFile(root() + "/private/1.tmp", root() + "/private/1");

    assertThat(env().fileExists(root() + "/private/1.tmp")).isFalse();
    assertThat(env().getChildren(root() + "/private")).containsExactly("1");
    assertThat(FakeBackupableDB.read(env(), root() + "/private/1/CURRENT"))
        .isEqualTo("c");
  }

  @Test
  public void fsyncDir() throws RocksDBException {
    env().createDirIfMissing(root() + "/shared");
    env().fsyncDir(root() + "/shared");
  }

  private static void assertNotFound(
      final ThrowingCallable callable) {
    assertThatThrownBy(callable)
        .isInstanceOf(RocksDBException.class)
        .satisfies(e -> assertThat(((RocksDBException) e).getStatus().getCode())
            .isEqualTo(Status.Code.NotFound));
  }
}
