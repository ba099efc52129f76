package common;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class MLIOUtils {

	public static <T extends Serializable> T readObjectFromFileGZ(
			final String file, final Class<T> classType) throws IOException {
		if ((new File(file)).exists() == false) {
			throw new IOException("file doesn't exist " + file);
		}

		try (ObjectInputStream objectInputStream = new ObjectInputStream(
				new GZIPInputStream(new BufferedInputStream(
						new FileInputStream(file))))) {
			Object o = objectInputStream.readObject();

			if (classType.isInstance(o) == true) {
				return classType.cast(o);
			} else {
				throw new IOException("failed to deserialize " + file
						+ " into class " + classType.getSimpleName());
			}
		} catch (ClassNotFoundException e) {
			throw new IOException("failed to deserialize " + file, e);
		}
	}

	public static void writeObjectToFileGZ(final Serializable object,
			final String file) throws IOException {
		try (ObjectOutputStream objectOutputStream = new ObjectOutputStream(
				new GZIPOutputStream(new BufferedOutputStream(
						new FileOutputStream(file))))) {
			objectOutputStream.writeObject(object);
		}
	}

}
